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

import java.util.ArrayList;
import java.util.List;

/**
 * Operation submitted to the backend conversation.
 */
public interface Operation {

    static Operation shutdown() {
        return Shutdown.INSTANCE;
    }

    /**
     * Builds a user-input operation carrying the message text followed by its
     * images.
     */
    static UserInput userInput(InputMessage message) {
        List<InputItem> items = new ArrayList<>();
        items.add(new InputItem.Text(message.text()));
        for (ImageInput image : message.images()) {
            items.add(new InputItem.Image(image));
        }
        return new UserInput(items);
    }

    record UserInput(List<InputItem> items) implements Operation {
        public UserInput {
            items = items != null ? List.copyOf(items) : List.of();
        }
    }

    record Shutdown() implements Operation {
        static final Shutdown INSTANCE = new Shutdown();
    }

    /**
     * Item of a user-input operation.
     */
    interface InputItem {

        record Text(String text) implements InputItem {
        }

        record Image(ImageInput image) implements InputItem {
        }
    }
}
