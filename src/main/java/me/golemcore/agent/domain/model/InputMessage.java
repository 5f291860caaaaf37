package me.golemcore.agent.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.List;
import java.util.Objects;

/**
 * User input sent to a running agent. Consumed exactly once by the execution
 * loop.
 */
public record InputMessage(String text, List<ImageInput> images) {

    public InputMessage {
        Objects.requireNonNull(text, "text");
        images = images != null ? List.copyOf(images) : List.of();
    }

    public static InputMessage of(String text) {
        return new InputMessage(text, List.of());
    }

    public static InputMessage withImages(String text, List<ImageInput> images) {
        return new InputMessage(text, images);
    }
}
