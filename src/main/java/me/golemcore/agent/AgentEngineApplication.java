package me.golemcore.agent;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore Agent Engine.
 *
 * <p>
 * The engine drives a conversation with an agent backend: it forwards user
 * input as turns, translates the backend's event stream into a uniform output
 * vocabulary and plan updates, and gives callers pause, resume and stop
 * control over a running session.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Domain Layer       → Agent, ExecutionLoop, EventTranslator, MessageProcessor
 * Ports              → BackendPort, ConversationPort
 * Infrastructure     → Backend adapters, configuration
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code agent.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AgentEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentEngineApplication.class, args);
    }

}
