package io.github.hide212131.langchain4j.deepagents.app.cli;

import dev.langchain4j.model.chat.ChatModel;
import io.github.hide212131.langchain4j.deepagents.runtime.AgentConfigurationException;
import io.github.hide212131.langchain4j.deepagents.runtime.DeepAgent;
import io.github.hide212131.langchain4j.deepagents.runtime.DeepAgentDefinition;
import io.github.hide212131.langchain4j.deepagents.runtime.DeepAgentFactory;
import io.github.hide212131.langchain4j.deepagents.runtime.agent.AgentRunException;
import io.github.hide212131.langchain4j.deepagents.runtime.agent.ToolLoopAgentRuntime;
import io.github.hide212131.langchain4j.deepagents.runtime.provider.ChatModelFactory;
import io.github.hide212131.langchain4j.deepagents.runtime.provider.LlmConfiguration;
import io.github.hide212131.langchain4j.deepagents.runtime.provider.LlmConfigurationLoader;
import io.github.hide212131.langchain4j.deepagents.runtime.provider.LlmProvider;
import io.github.hide212131.langchain4j.deepagents.runtime.state.Todo;
import io.github.hide212131.langchain4j.deepagents.runtime.state.WorkspaceState;
import io.github.hide212131.langchain4j.deepagents.runtime.subagent.SubAgentSpec;
import io.github.hide212131.langchain4j.deepagents.runtime.subagent.SubAgentSpecLoader;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Supplier;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Entry point that wires PicoCLI with the deep agent runtime.
 */
@Command(name = "deep-agent", mixinStandardHelpOptions = true,
        description = "Run a tool-using agent with a virtual workspace and sub-agent delegation")
public final class DeepAgentCliApp implements Runnable {

    public static void main(String[] args) {
        int exitCode = commandLineInstance().execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static CommandLine commandLineInstance() {
        CommandLine cmd = new CommandLine(new DeepAgentCliApp());
        cmd.addSubcommand(
                "run", new RunCommand(LlmConfigurationLoader::new, new SubAgentSpecLoader(), new ChatModelFactory()));
        return cmd;
    }

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    @Command(name = "run", description = "Run the agent on a single task")
    static final class RunCommand implements Callable<Integer> {

        @Option(names = "--task", description = "Task for the agent")
        String task;

        @Option(names = "--task-file", description = "Path to a text file containing the task")
        Path taskFile;

        @Option(names = "--instructions", description = "System instructions for the top-level agent",
                defaultValue = "You are a helpful assistant. Plan with write_todos and keep your work in the "
                        + "virtual filesystem.")
        String instructions;

        @Option(names = "--subagents", description = "YAML file declaring sub-agents")
        Path subAgentsFile;

        @Option(names = "--dry-run", description = "Use the deterministic mock model instead of a real provider")
        boolean dryRun;

        @Option(names = "--max-steps", description = "Model calls allowed per agent run (overrides DEEP_AGENT_MAX_STEPS)")
        Integer maxSteps;

        @Spec
        CommandSpec commandSpec;

        private final Supplier<LlmConfigurationLoader> configurationLoader;
        private final SubAgentSpecLoader subAgentSpecLoader;
        private final ChatModelFactory chatModelFactory;

        RunCommand(
                Supplier<LlmConfigurationLoader> configurationLoader,
                SubAgentSpecLoader subAgentSpecLoader,
                ChatModelFactory chatModelFactory) {
            this.configurationLoader = configurationLoader;
            this.subAgentSpecLoader = subAgentSpecLoader;
            this.chatModelFactory = chatModelFactory;
        }

        @Override
        public Integer call() {
            PrintWriter out = commandSpec.commandLine().getOut();
            PrintWriter err = commandSpec.commandLine().getErr();
            String resolvedTask = resolveTask(err);
            if (resolvedTask == null) {
                return 2;
            }
            try {
                LlmConfiguration configuration =
                        configurationLoader.get().load(dryRun ? LlmProvider.MOCK : null);
                if (maxSteps != null) {
                    configuration = configuration.withMaxSteps(maxSteps);
                }
                List<SubAgentSpec> subAgents = List.of();
                if (subAgentsFile != null) {
                    SubAgentSpecLoader.LoadResult loaded = subAgentSpecLoader.load(subAgentsFile);
                    loaded.warnings().forEach(warning -> out.println("Warning: " + warning));
                    subAgents = loaded.specs();
                }
                ChatModel chatModel = chatModelFactory.create(configuration);
                ToolLoopAgentRuntime runtime = new ToolLoopAgentRuntime(chatModel, configuration.maxSteps());
                DeepAgent agent = new DeepAgentFactory(runtime)
                        .create(new DeepAgentDefinition(null, instructions, List.of(), subAgents));
                agent.warnings().forEach(warning -> out.println("Warning: " + warning));
                out.println("Provider: " + configuration.provider().wireValue()
                        + " (model " + configuration.modelNameOrDefault()
                        + ", api key " + configuration.maskedApiKey() + ")");
                if (!subAgents.isEmpty()) {
                    out.println("Sub-agents: " + String.join(", ",
                            subAgents.stream().map(SubAgentSpec::name).toList()));
                }

                WorkspaceState result = agent.run(resolvedTask);
                printResult(out, result);
                out.flush();
                return 0;
            } catch (AgentConfigurationException | IllegalStateException | IllegalArgumentException ex) {
                err.println("Error: " + ex.getMessage());
                err.flush();
                return 2;
            } catch (AgentRunException ex) {
                err.println("Error: agent run failed: " + ex.getMessage());
                err.flush();
                return 1;
            }
        }

        private String resolveTask(PrintWriter err) {
            if (task != null && !task.isBlank()) {
                return task.trim();
            }
            if (taskFile == null) {
                err.println("Error: either --task or --task-file is required");
                err.flush();
                return null;
            }
            if (!Files.isRegularFile(taskFile)) {
                err.println("Error: task file not found: " + taskFile);
                err.flush();
                return null;
            }
            try {
                String content = Files.readString(taskFile, StandardCharsets.UTF_8).trim();
                if (content.isEmpty()) {
                    err.println("Error: task file is empty: " + taskFile);
                    err.flush();
                    return null;
                }
                return content;
            } catch (IOException ex) {
                err.println("Error: failed to read task file: " + ex.getMessage());
                err.flush();
                return null;
            }
        }

        private void printResult(PrintWriter out, WorkspaceState result) {
            out.println("Answer: " + result.lastMessageText().orElse("(no answer)"));
            if (!result.todos().isEmpty()) {
                out.println("Todos:");
                for (Todo todo : result.todos()) {
                    out.println("  - [" + todo.status().wireValue() + "] " + todo.content());
                }
            }
            if (!result.files().isEmpty()) {
                out.println("Files:");
                result.files().forEach((path, content) ->
                        out.println("  - " + path + " (" + content.length() + " chars)"));
            }
            out.println("Messages: " + result.messages().size());
        }
    }
}
