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

package dev.mars.stepflow.workflow.guardrail;

import dev.mars.stepflow.workflow.guardrail.scanner.BanSubstringsScanner;
import dev.mars.stepflow.workflow.guardrail.scanner.InvisibleTextScanner;
import dev.mars.stepflow.workflow.guardrail.scanner.JsonScanner;
import dev.mars.stepflow.workflow.guardrail.scanner.PiiScanner;
import dev.mars.stepflow.workflow.guardrail.scanner.RegexScanner;
import dev.mars.stepflow.workflow.guardrail.scanner.SecretsScanner;
import dev.mars.stepflow.workflow.guardrail.scanner.TokenLimitScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-keyed table of guardrail scanners.
 */
public class ScannerRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ScannerRegistry.class);

    private final Map<String, GuardrailScanner> scanners = new ConcurrentHashMap<>();

    /**
     * Registry holding the built-in scanners.
     */
    public static ScannerRegistry withBuiltins() {
        ScannerRegistry registry = new ScannerRegistry();
        registry.register(new SecretsScanner());
        PiiScanner pii = new PiiScanner();
        registry.register(pii);
        registry.registerAlias("sensitive", pii);
        registry.register(new RegexScanner());
        registry.register(new BanSubstringsScanner());
        registry.register(new InvisibleTextScanner());
        registry.register(new TokenLimitScanner());
        registry.register(new JsonScanner());
        return registry;
    }

    public void register(GuardrailScanner scanner) {
        Objects.requireNonNull(scanner, "Scanner cannot be null");
        registerAlias(scanner.getName(), scanner);
    }

    public void registerAlias(String name, GuardrailScanner scanner) {
        GuardrailScanner previous = scanners.put(name, scanner);
        if (previous != null) {
            logger.debug("Replaced guardrail scanner '{}'", name);
        }
    }

    public Optional<GuardrailScanner> getScanner(String name) {
        return Optional.ofNullable(scanners.get(name));
    }

    public boolean isRegistered(String name) {
        return scanners.containsKey(name);
    }

    public Set<String> getScannerNames() {
        return Collections.unmodifiableSet(new TreeSet<>(scanners.keySet()));
    }
}
