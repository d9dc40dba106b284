package com.taintgrep.maven;

import com.taintgrep.engine.AnalysisSummary;
import com.taintgrep.engine.EngineConfig;
import com.taintgrep.engine.EngineResult;
import com.taintgrep.engine.ExecutionStatistics;
import com.taintgrep.engine.RuleExecutionEngine;
import com.taintgrep.engine.RuleSet;
import com.taintgrep.engine.bytecode.BytecodeCallGraphBuilder;
import com.taintgrep.engine.bytecode.BytecodeTreeBuilder;
import com.taintgrep.engine.dataflow.CallGraph;
import com.taintgrep.engine.domain.Finding;
import com.taintgrep.engine.domain.Severity;
import com.taintgrep.engine.tree.UniversalNode;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.project.MavenProject;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Mojo(name = "scan", defaultPhase = LifecyclePhase.VERIFY, threadSafe = true)
public class ScanMojo extends AbstractMojo {

    @Parameter(defaultValue = "${project}", readonly = true)
    private MavenProject project;

    @Parameter(defaultValue = "${project.build.directory}", required = true)
    private File buildDirectory;

    /**
     * Fail the build when a finding at or above this severity exists. Empty disables.
     */
    @Parameter(property = "taintgrep.failOnSeverity", defaultValue = "")
    private String failOnSeverity;

    @Parameter(property = "taintgrep.maxDepth")
    private Integer maxDepth;

    @Parameter(defaultValue = "json")
    private String reportFormat;

    @Parameter(property = "taintgrep.skip", defaultValue = "false")
    private boolean skip;

    @Override
    public void execute() throws MojoExecutionException, MojoFailureException {
        if (skip) {
            getLog().info("taintgrep scan skipped");
            return;
        }
        getLog().info("taintgrep scan starting...");

        ScanResult result;
        try {
            Path classesDir = classesDirectory();
            if (!Files.exists(classesDir)) {
                getLog().warn("Classes directory not found: " + classesDir);
                return;
            }
            result = scan(classesDir);
            getLog().info("Scanned " + result.filesScanned + " class file(s), found "
                + result.findings.size() + " finding(s)");
            generateReports(result);
        } catch (IOException e) {
            throw new MojoExecutionException("Scan failed", e);
        }

        Severity threshold = Severity.parse(failOnSeverity);
        if (threshold != null) {
            int blocking = new AnalysisSummary(result.findings).countAtLeast(threshold);
            if (blocking > 0) {
                throw new MojoFailureException(blocking + " finding(s) at or above " + threshold);
            }
        }
        getLog().info("Scan complete");
    }

    /**
     * The project's output directory, or {@code classes} under the build directory outside a build.
     */
    private Path classesDirectory() {
        if (project != null && project.getBuild() != null && project.getBuild().getOutputDirectory() != null) {
            return Paths.get(project.getBuild().getOutputDirectory());
        }
        return Paths.get(buildDirectory.getAbsolutePath(), "classes");
    }

    private ScanResult scan(Path classesDir) throws IOException {
        EngineConfig config = EngineConfig.fromSystemProperties();
        if (maxDepth != null) {
            config.setMaxDepth(maxDepth);
        }
        RuleExecutionEngine engine = new RuleExecutionEngine(config);
        RuleSet rules = RuleSet.defaults();
        BytecodeTreeBuilder treeBuilder = new BytecodeTreeBuilder();

        List<Path> classFiles;
        try (Stream<Path> paths = Files.walk(classesDir)) {
            classFiles = paths.filter(p -> p.toString().endsWith(".class")).sorted().collect(Collectors.toList());
        }

        ScanResult result = new ScanResult();
        List<UniversalNode> trees = new ArrayList<>();
        for (Path classFile : classFiles) {
            String relative = classesDir.relativize(classFile).toString().replace(File.separatorChar, '/');
            try {
                getLog().debug("Scanning: " + relative);
                UniversalNode tree = treeBuilder.build(classFile);
                EngineResult engineResult = engine.executeRules(rules.getRules(), tree, BytecodeTreeBuilder.LANGUAGE,
                    relative);
                result.findings.addAll(engineResult.getFindings());
                result.statistics.merge(engineResult.getStatistics());
                result.sensitiveConstants += engine.analyzeConstants(tree).getSensitiveConstants().size();
                trees.add(tree);
                result.filesScanned++;
            } catch (IOException | RuntimeException e) {
                getLog().warn("Scan failed for " + relative, e);
                result.filesFailed++;
            }
        }

        CallGraph callGraph = new BytecodeCallGraphBuilder().build(trees);
        result.functions = callGraph.functionCount();
        result.calls = callGraph.callCount();
        return result;
    }

    private void generateReports(ScanResult result) throws IOException {
        Path reportDir = Paths.get(buildDirectory.getAbsolutePath(), "taintgrep-reports");
        Files.createDirectories(reportDir);

        if (reportFormat != null && reportFormat.toLowerCase(Locale.ROOT).contains("json")) {
            Files.write(reportDir.resolve("summary.json"), buildJsonReport(result).getBytes(StandardCharsets.UTF_8));
        }
    }

    String buildJsonReport(ScanResult result) {
        AnalysisSummary summary = new AnalysisSummary(result.findings);
        StringBuilder sb = new StringBuilder();
        sb.append("{\n");
        sb.append("  \"filesScanned\": ").append(result.filesScanned).append(",\n");
        sb.append("  \"filesFailed\": ").append(result.filesFailed).append(",\n");
        sb.append("  \"rulesExecuted\": ").append(result.statistics.getRulesExecuted()).append(",\n");
        sb.append("  \"functions\": ").append(result.functions).append(",\n");
        sb.append("  \"calls\": ").append(result.calls).append(",\n");
        sb.append("  \"sensitiveConstants\": ").append(result.sensitiveConstants).append(",\n");
        sb.append("  \"totalFindings\": ").append(summary.getTotal()).append(",\n");
        sb.append("  \"errors\": ").append(summary.getErrors()).append(",\n");
        sb.append("  \"warnings\": ").append(summary.getWarnings()).append(",\n");
        sb.append("  \"infos\": ").append(summary.getInfos()).append(",\n");
        sb.append("  \"findings\": [\n");
        for (int i = 0; i < result.findings.size(); i++) {
            Finding finding = result.findings.get(i);
            sb.append("    {");
            sb.append("\"rule\":\"").append(escape(finding.getRuleId())).append("\",");
            sb.append("\"severity\":\"").append(finding.getSeverity()).append("\",");
            sb.append("\"confidence\":\"").append(finding.getConfidence()).append("\",");
            sb.append("\"file\":\"").append(escape(finding.getLocation().getFile())).append("\",");
            sb.append("\"line\":").append(finding.getLocation().getStartLine()).append(",");
            sb.append("\"message\":\"").append(escape(finding.getMessage())).append("\"");
            String dataflow = finding.getMetadata().get("dataflow");
            if (dataflow != null) {
                sb.append(",\"dataflow\":\"").append(escape(dataflow)).append("\"");
            }
            sb.append("}");
            if (i < result.findings.size() - 1) {
                sb.append(",");
            }
            sb.append("\n");
        }
        sb.append("  ]\n");
        sb.append("}\n");
        return sb.toString();
    }

    private String escape(String input) {
        if (input == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(input.length());
        for (int i = 0; i < input.length(); i++) {
            char ch = input.charAt(i);
            switch (ch) {
                case '\\':
                    sb.append("\\\\");
                    break;
                case '"':
                    sb.append("\\\"");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    if (ch < 0x20) {
                        sb.append(String.format("\\u%04x", (int) ch));
                    } else {
                        sb.append(ch);
                    }
            }
        }
        return sb.toString();
    }

    static final class ScanResult {
        final List<Finding> findings = new ArrayList<>();
        final ExecutionStatistics statistics = new ExecutionStatistics();
        int filesScanned;
        int filesFailed;
        int sensitiveConstants;
        int functions;
        int calls;
    }
}
