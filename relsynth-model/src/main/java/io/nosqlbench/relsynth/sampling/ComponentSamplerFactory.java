/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.relsynth.sampling;

import io.nosqlbench.relsynth.model.NormalScalarModel;
import io.nosqlbench.relsynth.model.ScalarModel;
import io.nosqlbench.relsynth.model.UniformScalarModel;

/// Factory for creating bound ComponentSampler instances.
///
/// The type dispatch happens once here, not on every sample call.
///
/// @see ComponentSampler
public final class ComponentSamplerFactory {

    private ComponentSamplerFactory() {
        // Factory class, no instantiation
    }

    /// Creates a sampler bound to the given model.
    ///
    /// @param model the scalar model
    /// @return a ComponentSampler bound to the model's parameters
    /// @throws IllegalArgumentException if the model type is not supported
    public static ComponentSampler forModel(ScalarModel model) {
        if (model instanceof NormalScalarModel) {
            return new NormalSampler((NormalScalarModel) model);
        } else if (model instanceof UniformScalarModel) {
            return new UniformSampler((UniformScalarModel) model);
        } else {
            throw new IllegalArgumentException(
                "No sampler for model type: " + model.getClass().getName());
        }
    }

    /// Creates an array of samplers for the given models.
    ///
    /// @param models the scalar models, one per column
    /// @return an array of bound samplers
    public static ComponentSampler[] forModels(ScalarModel[] models) {
        ComponentSampler[] samplers = new ComponentSampler[models.length];
        for (int i = 0; i < models.length; i++) {
            samplers[i] = forModel(models[i]);
        }
        return samplers;
    }
}
