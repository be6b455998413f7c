package com.harden.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "harden")
public class HardenProperties {

    private Discovery discovery = new Discovery();
    private Tool tool = new Tool();
    private Sidecar sidecar = new Sidecar();

    // -- Discovery accessors (delegate to nested) --
    public Path getProjectRoot() { return Path.of(discovery.root).toAbsolutePath().normalize(); }
    public Path getSourceRoot() { return getProjectRoot().resolve(discovery.sourceDir).normalize(); }

    // -- Tool accessors (delegate to nested) --

    /**
     * Full command line prefix for the reasoning tool; the prompt is appended as the last argument.
     */
    public List<String> getToolCommandLine() {
        var command = new ArrayList<String>();
        command.add(tool.command);
        command.addAll(tool.args);
        return command;
    }

    public Discovery getDiscovery() { return discovery; }
    public void setDiscovery(Discovery discovery) { this.discovery = discovery; }
    public Tool getTool() { return tool; }
    public void setTool(Tool tool) { this.tool = tool; }
    public Sidecar getSidecar() { return sidecar; }
    public void setSidecar(Sidecar sidecar) { this.sidecar = sidecar; }

    public static class Discovery {
        private String root = ".";
        private String sourceDir = "app/controllers";
        private String suffix = "_controller.rb";
        private List<String> excludeNames = new ArrayList<>(List.of("application_controller"));
        private List<String> excludeDirs = new ArrayList<>(List.of("concerns"));

        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
        public String getSourceDir() { return sourceDir; }
        public void setSourceDir(String sourceDir) { this.sourceDir = sourceDir; }
        public String getSuffix() { return suffix; }
        public void setSuffix(String suffix) { this.suffix = suffix; }
        public List<String> getExcludeNames() { return excludeNames; }
        public void setExcludeNames(List<String> excludeNames) { this.excludeNames = excludeNames; }
        public List<String> getExcludeDirs() { return excludeDirs; }
        public void setExcludeDirs(List<String> excludeDirs) { this.excludeDirs = excludeDirs; }
    }

    public static class Tool {
        private String command = "claude";
        private List<String> args = new ArrayList<>(List.of("-p"));
        private String workingDirectory = "";
        /** Zero means wait indefinitely. */
        private Duration timeout = Duration.ZERO;
        /** Zero means no cap on simultaneous invocations. */
        private int maxConcurrent = 0;

        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public List<String> getArgs() { return args; }
        public void setArgs(List<String> args) { this.args = args; }
        public String getWorkingDirectory() { return workingDirectory; }
        public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }
    }

    public static class Sidecar {
        private String dirName = ".harden";

        public String getDirName() { return dirName; }
        public void setDirName(String dirName) { this.dirName = dirName; }
    }
}
