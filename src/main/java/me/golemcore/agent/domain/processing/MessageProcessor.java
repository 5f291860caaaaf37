package me.golemcore.agent.domain.processing;

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

import me.golemcore.agent.domain.model.OutputMessage;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Optional post-processing chain for the output stream.
 *
 * <p>
 * Each message goes through the stages in a fixed order:
 * <ol>
 * <li>filters: the first one that rejects the message drops it</li>
 * <li>transformers: applied in registration order</li>
 * <li>aggregators: applied in registration order, each receiving what the
 * previous one emitted; an aggregator that emits nothing ends the chain for
 * that message</li>
 * </ol>
 *
 * <p>
 * Call {@link #flush()} once after the last message to drain aggregator
 * buffers. A processor holds aggregator state and belongs to one stream.
 */
public class MessageProcessor {

    private final List<MessageFilter> filters;
    private final List<MessageTransformer> transformers;
    private final List<MessageAggregator> aggregators;

    private MessageProcessor(Builder builder) {
        this.filters = List.copyOf(builder.filters);
        this.transformers = List.copyOf(builder.transformers);
        this.aggregators = List.copyOf(builder.aggregators);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<OutputMessage> process(OutputMessage message) {
        Objects.requireNonNull(message, "message");
        for (MessageFilter filter : filters) {
            if (!filter.accept(message)) {
                return Optional.empty();
            }
        }

        OutputMessage current = message;
        for (MessageTransformer transformer : transformers) {
            current = transformer.transform(current);
        }

        for (MessageAggregator aggregator : aggregators) {
            Optional<OutputMessage> emitted = aggregator.aggregate(current);
            if (emitted.isEmpty()) {
                return Optional.empty();
            }
            current = emitted.get();
        }
        return Optional.of(current);
    }

    /**
     * Collects the residue of every aggregator, in registration order.
     */
    public List<OutputMessage> flush() {
        List<OutputMessage> residue = new ArrayList<>();
        for (MessageAggregator aggregator : aggregators) {
            residue.addAll(aggregator.flush());
        }
        return residue;
    }

    /**
     * Applies this processor to a whole stream and flushes when it completes.
     */
    public Flux<OutputMessage> apply(Flux<OutputMessage> messages) {
        return messages
                .concatMap(message -> Mono.justOrEmpty(process(message)))
                .concatWith(Flux.defer(() -> Flux.fromIterable(flush())));
    }

    public static class Builder {

        private final List<MessageFilter> filters = new ArrayList<>();
        private final List<MessageTransformer> transformers = new ArrayList<>();
        private final List<MessageAggregator> aggregators = new ArrayList<>();

        public Builder filter(MessageFilter filter) {
            filters.add(Objects.requireNonNull(filter, "filter"));
            return this;
        }

        public Builder transform(MessageTransformer transformer) {
            transformers.add(Objects.requireNonNull(transformer, "transformer"));
            return this;
        }

        public Builder aggregate(MessageAggregator aggregator) {
            aggregators.add(Objects.requireNonNull(aggregator, "aggregator"));
            return this;
        }

        public Builder filterToolOutput() {
            return filter(new ToolOutputFilter());
        }

        public Builder filterByType(String... typeNames) {
            return filter(new TypeFilter(Arrays.asList(typeNames)));
        }

        public Builder stripAnsiCodes() {
            return transform(new AnsiStripper());
        }

        public Builder truncateLines(int maxLength) {
            return transform(new LineTruncator(maxLength));
        }

        public Builder aggregateDeltas() {
            return aggregate(new DeltaAggregator());
        }

        public Builder removeDuplicates() {
            return aggregate(new DuplicateRemover());
        }

        public MessageProcessor build() {
            return new MessageProcessor(this);
        }
    }
}
