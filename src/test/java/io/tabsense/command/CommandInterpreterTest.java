package io.tabsense.command;

import io.tabsense.model.Capability;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;

final class CommandInterpreterTest {

    @Test
    void keywordsSelectCapability() {
        Assertions.assertEquals(Capability.AUTOMATION, CommandInterpreter.interpret("Fill the signup form").capability());
        Assertions.assertEquals(Capability.WEB_ANALYSIS, CommandInterpreter.interpret("help me UNDERSTAND this article").capability());
        Assertions.assertEquals(Capability.PERFORMANCE, CommandInterpreter.interpret("speed this page up").capability());
        Assertions.assertEquals(Capability.SECURITY, CommandInterpreter.interpret("is it safe to log in").capability());
        Assertions.assertEquals(Capability.ACCESSIBILITY, CommandInterpreter.interpret("run an a11y check").capability());
    }

    @Test
    void earlierGroupWinsOnOverlap() {
        CommandInterpreter.CommandPlan plan = CommandInterpreter.interpret("analyze then click submit");

        Assertions.assertEquals(Capability.AUTOMATION, plan.capability());
        Assertions.assertEquals("click", plan.matchedKeyword());
    }

    @Test
    void unmatchedCommandFallsBackToAiInteraction() {
        CommandInterpreter.CommandPlan plan = CommandInterpreter.interpret("  translate the headline  ");

        Assertions.assertEquals(Capability.AI_INTERACTION, plan.capability());
        Assertions.assertNull(plan.matchedKeyword());
        Assertions.assertEquals(Map.of("instruction", "translate the headline"), plan.parameters());
    }

    @Test
    void blankCommandIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> CommandInterpreter.interpret(" "));
        Assertions.assertThrows(IllegalArgumentException.class, () -> CommandInterpreter.interpret(null));
    }
}
