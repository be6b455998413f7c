package com.harden.core.prompts;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the self-contained prompts sent to the reasoning tool.
 * Pure functions, no Spring dependencies.
 */
public final class PromptBuilder {

    private static final Map<String, String> FENCE_LANGUAGES = Map.of(
            "rb", "ruby",
            "py", "python",
            "js", "javascript",
            "ts", "typescript",
            "kt", "kotlin",
            "cs", "csharp"
    );

    private PromptBuilder() {}

    /**
     * Analysis: identify hardening opportunities in one unit.
     */
    public static String analyze(String unitName, String fileName, String source) {
        var sb = new StringBuilder();
        sb.append("You are a security hardening specialist. Analyze this source file and identify ");
        sb.append("all hardening opportunities.\n\n");
        appendSource(sb, unitName, fileName, source);

        sb.append("## Your Task\n\n");
        sb.append("Analyze this file for:\n");
        sb.append("1. Missing or weak input filtering (e.g. strong parameters)\n");
        sb.append("2. Authorization gaps (actions missing auth checks)\n");
        sb.append("3. Input validation issues\n");
        sb.append("4. Missing rate limiting\n");
        sb.append("5. CSRF concerns\n");
        sb.append("6. Unsafe redirects\n");
        sb.append("7. Information leakage in error handling\n");
        sb.append("8. Missing or incorrect HTTP status codes\n");
        sb.append("9. Query patterns with security or availability implications\n");
        sb.append("10. Any other security or hardening concerns\n\n");

        sb.append("## Output Format\n\n");
        sb.append("Respond with ONLY this JSON (no markdown fences, no preamble):\n\n");
        sb.append("{\n");
        sb.append("  \"unit\": \"").append(unitName).append("\",\n");
        sb.append("  \"status\": \"analyzed\",\n");
        sb.append("  \"findings\": [\n");
        sb.append("    {\n");
        sb.append("      \"id\": \"finding_001\",\n");
        sb.append("      \"severity\": \"high|medium|low\",\n");
        sb.append("      \"category\": \"authorization|validation|params|rate_limiting|csrf|redirect|info_leak|other\",\n");
        sb.append("      \"action\": \"action_name or null if file-wide\",\n");
        sb.append("      \"summary\": \"Brief one-line description\",\n");
        sb.append("      \"detail\": \"Detailed explanation of the issue\",\n");
        sb.append("      \"suggested_fix\": \"What should be done\"\n");
        sb.append("    }\n");
        sb.append("  ],\n");
        sb.append("  \"overall_risk\": \"high|medium|low\",\n");
        sb.append("  \"notes\": \"Any general observations about this file\"\n");
        sb.append("}\n");
        return sb.toString();
    }

    /**
     * Hardening: apply the changes the human approved.
     */
    public static String harden(String unitName, String fileName, String source,
                                String analysisJson, JsonNode decision) {
        var sb = new StringBuilder();
        sb.append("You are a security hardening specialist. Apply the approved hardening changes ");
        sb.append("to this source file.\n\n");
        appendSource(sb, unitName, fileName, source);

        sb.append("## Analysis Findings\n\n```json\n").append(analysisJson).append("\n```\n\n");
        sb.append("## Human Decision\n\n").append(decisionInstructions(decision)).append("\n\n");

        sb.append("## Your Task\n\n");
        sb.append("Apply the hardening changes and return the complete modified file. ");
        sb.append("Do not write any files yourself.\n\n");

        sb.append("## Output Format\n\n");
        sb.append("Respond with ONLY this JSON (no markdown fences, no preamble):\n\n");
        sb.append("{\n");
        sb.append("  \"unit\": \"").append(unitName).append("\",\n");
        sb.append("  \"status\": \"hardened\",\n");
        sb.append("  \"summary\": \"Brief description of changes made\",\n");
        sb.append("  \"hardened_source\": \"The complete hardened file contents\",\n");
        sb.append("  \"changes_applied\": [\n");
        sb.append("    {\n");
        sb.append("      \"finding_id\": \"finding_001\",\n");
        sb.append("      \"action_taken\": \"Description of what was changed\",\n");
        sb.append("      \"lines_affected\": \"Brief description\"\n");
        sb.append("    }\n");
        sb.append("  ],\n");
        sb.append("  \"warnings\": [\"Any caveats or things the human should review\"]\n");
        sb.append("}\n");
        return sb.toString();
    }

    /**
     * Verification: audit the hardened source against the original analysis.
     */
    public static String verify(String unitName, String fileName, String originalSource,
                                String hardenedSource, String analysisJson) {
        String language = fenceLanguage(fileName);
        var sb = new StringBuilder();
        sb.append("You are a security auditor. Verify that hardening was applied correctly.\n\n");
        sb.append("## Unit: ").append(unitName).append("\n\n");
        sb.append("### Original\n\n```").append(language).append("\n").append(originalSource).append("\n```\n\n");
        sb.append("### Hardened\n\n```").append(language).append("\n").append(hardenedSource).append("\n```\n\n");
        sb.append("### Original Analysis\n\n```json\n").append(analysisJson).append("\n```\n\n");

        sb.append("## Your Task\n\n");
        sb.append("1. Verify each finding from the analysis was addressed\n");
        sb.append("2. Check that no new issues were introduced\n");
        sb.append("3. Confirm the hardened code is syntactically valid\n");
        sb.append("4. Flag any concerns\n\n");

        sb.append("## Output Format\n\n");
        sb.append("Respond with ONLY this JSON (no markdown fences, no preamble):\n\n");
        sb.append("{\n");
        sb.append("  \"unit\": \"").append(unitName).append("\",\n");
        sb.append("  \"status\": \"verified\",\n");
        sb.append("  \"findings_addressed\": [\n");
        sb.append("    { \"finding_id\": \"finding_001\", \"addressed\": true, \"notes\": \"\" }\n");
        sb.append("  ],\n");
        sb.append("  \"new_issues\": [],\n");
        sb.append("  \"syntax_valid\": true,\n");
        sb.append("  \"recommendation\": \"accept|review|reject\",\n");
        sb.append("  \"notes\": \"\"\n");
        sb.append("}\n");
        return sb.toString();
    }

    /**
     * Ad-hoc question about a unit.
     */
    public static String ask(String unitName, String fileName, String source,
                             String analysisJson, String question) {
        var sb = new StringBuilder();
        sb.append("You are a security specialist. Answer this question about a source file.\n\n");
        appendSource(sb, unitName, fileName, source);
        sb.append("## Analysis\n\n```json\n").append(analysisJson).append("\n```\n\n");
        sb.append("## Question\n\n").append(question).append("\n\n");
        sb.append("Answer concisely and practically. Reference specific lines or methods when relevant.\n");
        return sb.toString();
    }

    /**
     * Ad-hoc explanation of one finding.
     */
    public static String explain(String unitName, String fileName, String source, String findingJson) {
        var sb = new StringBuilder();
        sb.append("You are a security specialist. Explain this finding in plain terms.\n\n");
        appendSource(sb, unitName, fileName, source);
        sb.append("## Finding\n\n```json\n").append(findingJson).append("\n```\n\n");
        sb.append("Explain:\n");
        sb.append("1. What the risk is in practical terms (what could an attacker do?)\n");
        sb.append("2. How to fix it (show code)\n");
        sb.append("3. How serious it is relative to other common issues of this kind\n\n");
        sb.append("Be concise. Aim for a developer who knows the framework but isn't a security specialist.\n");
        return sb.toString();
    }

    /**
     * Translates a human decision into hardening instructions.
     * Actions other than the known ones are passed through verbatim.
     */
    static String decisionInstructions(JsonNode decision) {
        String action = decision != null && decision.hasNonNull("action") ? decision.get("action").asText() : "";
        switch (action) {
            case "approve":
                return "Apply ALL suggested fixes from the analysis.";
            case "modify":
                return "Apply the suggested fixes with these modifications:\n" + text(decision, "notes");
            case "selective":
                return "Only address these specific findings: " + String.join(", ", approvedFindings(decision))
                        + ". Leave everything else unchanged.";
            default:
                return "Apply the suggested fixes according to this decision:\n```json\n"
                        + (decision != null ? decision.toString() : "{}") + "\n```";
        }
    }

    /**
     * Markdown fence language for a file name, derived from its extension.
     */
    static String fenceLanguage(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "";
        }
        String ext = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        return FENCE_LANGUAGES.getOrDefault(ext, ext);
    }

    private static void appendSource(StringBuilder sb, String unitName, String fileName, String source) {
        sb.append("## Unit: ").append(unitName).append("\n\n");
        sb.append("```").append(fenceLanguage(fileName)).append("\n");
        sb.append(source).append("\n```\n\n");
    }

    private static List<String> approvedFindings(JsonNode decision) {
        var ids = new ArrayList<String>();
        JsonNode approved = decision.get("approved_findings");
        if (approved != null && approved.isArray()) {
            approved.forEach(id -> ids.add(id.asText()));
        }
        return ids;
    }

    private static String text(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : "";
    }
}
