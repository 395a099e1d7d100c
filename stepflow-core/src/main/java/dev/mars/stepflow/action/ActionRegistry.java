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

package dev.mars.stepflow.action;

import dev.mars.stepflow.action.control.BreakAction;
import dev.mars.stepflow.action.control.ContinueAction;
import dev.mars.stepflow.action.control.ExitAction;
import dev.mars.stepflow.action.control.FailAction;
import dev.mars.stepflow.action.control.WaitAction;
import dev.mars.stepflow.action.file.FileReadAction;
import dev.mars.stepflow.action.file.FileWriteAction;
import dev.mars.stepflow.action.http.HttpRequestAction;
import dev.mars.stepflow.action.human.HumanDecideAction;
import dev.mars.stepflow.action.human.HumanInputAction;
import dev.mars.stepflow.action.llm.LlmAnalyzeAction;
import dev.mars.stepflow.action.llm.LlmClient;
import dev.mars.stepflow.action.llm.LlmDecideAction;
import dev.mars.stepflow.action.llm.LlmExtractAction;
import dev.mars.stepflow.action.llm.LlmGenerateAction;
import dev.mars.stepflow.action.llm.LlmInstructAction;
import dev.mars.stepflow.action.notify.NotifyWebhookAction;
import dev.mars.stepflow.action.parse.ParseJsonAction;
import dev.mars.stepflow.action.parse.ParseRegexAction;
import dev.mars.stepflow.action.report.InMemoryReportStore;
import dev.mars.stepflow.action.report.ReportAddAction;
import dev.mars.stepflow.action.report.ReportListAction;
import dev.mars.stepflow.action.report.ReportStore;
import dev.mars.stepflow.action.shell.ProcessRunner;
import dev.mars.stepflow.action.shell.ScriptAction;
import dev.mars.stepflow.action.shell.ShellAction;
import dev.mars.stepflow.action.state.StateAppendAction;
import dev.mars.stepflow.action.state.StateSetAction;
import dev.mars.stepflow.config.StepflowConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Capability-keyed table mapping action identifiers to their implementations.
 * New actions are added by registration; the engine never branches on action ids.
 */
public class ActionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ActionRegistry.class);

    private final Map<String, WorkflowAction> actions = new ConcurrentHashMap<>();

    /**
     * Creates an empty registry.
     */
    public ActionRegistry() {
    }

    /**
     * Creates a registry holding every built-in action.
     *
     * @param configuration engine configuration
     * @param llmClient LLM collaborator, may be {@code null} when no llm/* step is used
     * @param reportStore finding store, an in-memory store is used when {@code null}
     */
    public static ActionRegistry withBuiltins(StepflowConfiguration configuration,
                                              LlmClient llmClient,
                                              ReportStore reportStore) {
        ActionRegistry registry = new ActionRegistry();
        registry.registerBuiltins(configuration, llmClient,
                reportStore != null ? reportStore : new InMemoryReportStore());
        return registry;
    }

    private void registerBuiltins(StepflowConfiguration configuration, LlmClient llmClient, ReportStore reportStore) {
        ProcessRunner processRunner = new ProcessRunner(configuration);
        register(new ShellAction(configuration, processRunner));
        register(ScriptAction.bash(configuration, processRunner));
        register(ScriptAction.python(configuration, processRunner));

        register(new HttpRequestAction(configuration));
        register(new NotifyWebhookAction(configuration));

        register(new LlmExtractAction(llmClient));
        register(new LlmDecideAction(llmClient));
        register(new LlmAnalyzeAction(llmClient));
        register(new LlmGenerateAction(llmClient));
        register(new LlmInstructAction(llmClient, configuration.isLlmAirgapped()));

        register(new HumanInputAction());
        register(new HumanDecideAction());

        register(new StateSetAction());
        register(new StateAppendAction());

        register(new ExitAction());
        register(new FailAction());
        register(new BreakAction());
        register(new ContinueAction());
        register(new WaitAction(configuration));

        register(new FileReadAction(configuration));
        register(new FileWriteAction(configuration));

        register(new ParseJsonAction());
        register(new ParseRegexAction());

        register(new ReportAddAction(reportStore));
        register(new ReportListAction(reportStore));

        int builtins = actions.size();
        registerShortAliases();
        logger.info("Registered {} built-in actions", builtins);
    }

    private void registerShortAliases() {
        Map<String, String> aliases = new LinkedHashMap<>();
        aliases.put("shell", "run");
        aliases.put("bash", "script/bash");
        aliases.put("python", "script/python");
        aliases.put("http", "http/request");
        aliases.put("webhook", "notify/webhook");
        aliases.put("set", "state/set");
        aliases.put("append", "state/append");
        aliases.put("exit", "control/exit");
        aliases.put("fail", "control/fail");
        aliases.put("break", "control/break");
        aliases.put("continue", "control/continue");
        aliases.put("wait", "control/wait");
        aliases.put("input", "human/input");
        aliases.put("read", "file/read");
        aliases.put("write", "file/write");
        aliases.put("json", "parse/json");
        aliases.put("regex", "parse/regex");
        aliases.forEach((alias, target) -> getAction(target).ifPresent(action -> registerAlias(alias, action)));
    }

    public void register(WorkflowAction action) {
        actions.put(normalize(action.getActionId()), action);
        logger.debug("Registered action: {}", action.getActionId());
    }

    /**
     * Register an action under an additional identifier
     */
    public void registerAlias(String alias, WorkflowAction action) {
        actions.put(normalize(alias), action);
        logger.debug("Registered action alias: {} -> {}", alias, action.getActionId());
    }

    public Optional<WorkflowAction> getAction(String actionId) {
        if (actionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(actions.get(normalize(actionId)));
    }

    public boolean isSupported(String actionId) {
        return actionId != null && actions.containsKey(normalize(actionId));
    }

    public Set<String> getActionIds() {
        return new TreeSet<>(actions.keySet());
    }

    public void unregister(String actionId) {
        if (actionId != null) {
            actions.remove(normalize(actionId));
            logger.debug("Unregistered action: {}", actionId);
        }
    }

    private static String normalize(String actionId) {
        return actionId.trim().toLowerCase();
    }
}
