package io.tabsense.command;

import io.tabsense.model.Capability;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a free-text command to the capability that should handle it. Keywords are matched as
 * substrings of the lower-cased command, in declaration order.
 */
public final class CommandInterpreter {
    private static final Map<Capability, List<String>> KEYWORDS = keywords();

    private CommandInterpreter() {
    }

    public static CommandPlan interpret(String command) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command must not be blank");
        }
        String instruction = command.trim();
        String normalized = instruction.toLowerCase(Locale.ROOT);
        for (Map.Entry<Capability, List<String>> entry : KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (normalized.contains(keyword)) {
                    return new CommandPlan(entry.getKey(), instruction, keyword);
                }
            }
        }
        return new CommandPlan(Capability.AI_INTERACTION, instruction, null);
    }

    private static Map<Capability, List<String>> keywords() {
        Map<Capability, List<String>> out = new LinkedHashMap<>();
        out.put(Capability.AUTOMATION, List.of("click", "fill", "automate"));
        out.put(Capability.WEB_ANALYSIS, List.of("analyze", "understand"));
        out.put(Capability.PERFORMANCE, List.of("optimize", "speed"));
        out.put(Capability.SECURITY, List.of("secure", "safe"));
        out.put(Capability.ACCESSIBILITY, List.of("accessible", "a11y"));
        return out;
    }

    /**
     * @param matchedKeyword keyword that selected the capability, or {@code null} for the fallback
     */
    public record CommandPlan(Capability capability, String instruction, String matchedKeyword) {
        public Map<String, Object> parameters() {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("instruction", instruction);
            return params;
        }
    }
}
