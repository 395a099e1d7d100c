/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.stepflow.workflow.expression;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed table of the filters available to expressions. The evaluator consults
 * nothing else, so expressions cannot reach host objects or methods.
 */
public class FilterRegistry {

    private static final FilterRegistry DEFAULTS = createDefaults();

    private final Map<String, Entry> filters = new ConcurrentHashMap<>();

    /**
     * Registry holding the built-in filters. Shared and read-only.
     */
    public static FilterRegistry defaults() {
        return DEFAULTS;
    }

    private static FilterRegistry createDefaults() {
        FilterRegistry registry = new FilterRegistry();
        BuiltinFilters.registerAll(registry);
        return registry.frozen();
    }

    /**
     * Creates a mutable copy, used to add application specific filters.
     */
    public FilterRegistry copy() {
        FilterRegistry copy = new FilterRegistry();
        copy.filters.putAll(filters);
        return copy;
    }

    public void register(String name, int minArguments, int maxArguments, ExpressionFilter filter) {
        filters.put(name, new Entry(filter, minArguments, maxArguments));
    }

    public boolean contains(String name) {
        return filters.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(filters.keySet()));
    }

    public Optional<ExpressionFilter> lookup(String name) {
        Entry entry = filters.get(name);
        return entry != null ? Optional.of(entry.filter) : Optional.empty();
    }

    /**
     * Applies a filter after checking its argument count.
     */
    public Object apply(String name, Object subject, List<Object> arguments) {
        Entry entry = filters.get(name);
        if (entry == null) {
            throw new ExpressionException("unknown filter '" + name + "'");
        }
        if (arguments.size() < entry.minArguments || arguments.size() > entry.maxArguments) {
            String expected = entry.minArguments == entry.maxArguments
                    ? String.valueOf(entry.minArguments)
                    : entry.minArguments + " to " + entry.maxArguments;
            throw new ExpressionException("filter '" + name + "' takes " + expected
                    + " argument(s), got " + arguments.size());
        }
        return entry.filter.apply(subject, arguments);
    }

    private FilterRegistry frozen() {
        return new FilterRegistry() {
            {
                super.filters.putAll(FilterRegistry.this.filters);
            }

            @Override
            public void register(String name, int minArguments, int maxArguments, ExpressionFilter filter) {
                throw new UnsupportedOperationException("the default filter registry is read-only, use copy()");
            }
        };
    }

    private static final class Entry {
        private final ExpressionFilter filter;
        private final int minArguments;
        private final int maxArguments;

        private Entry(ExpressionFilter filter, int minArguments, int maxArguments) {
            this.filter = filter;
            this.minArguments = minArguments;
            this.maxArguments = maxArguments;
        }
    }
}
