package de.entwicklertraining.chat.fetcher;

import de.entwicklertraining.chat.fetcher.model.ChatMessage;
import de.entwicklertraining.chat.fetcher.model.ChatRequestOptions;
import de.entwicklertraining.chat.fetcher.model.FunctionDeclaration;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Rejects request payloads that the provider would refuse, before any network traffic.
 */
public class PayloadValidator {

    private static final Pattern FUNCTION_NAME = Pattern.compile("^[a-zA-Z0-9_-]+$");

    private final int hardToolLimit;

    public PayloadValidator(int hardToolLimit) {
        this.hardToolLimit = hardToolLimit;
    }

    public ValidationResult validate(List<ChatMessage> messages, ChatRequestOptions options) {
        if (messages == null || messages.isEmpty()) {
            return ValidationResult.invalid(asUnexpected("No messages provided"));
        }
        if (options.getMaxTokens().isPresent() && options.getMaxTokens().get() < 1) {
            return ValidationResult.invalid(asUnexpected("Invalid response token parameter"));
        }

        boolean invalidFunctionName = options.getFunctions().stream().map(FunctionDeclaration::name).anyMatch(name -> !isValidName(name))
                || options.getFunctionCall().filter(name -> !isValidName(name)).isPresent();
        if (invalidFunctionName) {
            return ValidationResult.invalid(asUnexpected("Function names must match ^[a-zA-Z0-9_-]+$"));
        }
        boolean invalidToolName = options.getTools().stream().anyMatch(tool -> !isValidName(tool.function().name()));
        if (invalidToolName) {
            return ValidationResult.invalid(asUnexpected("Tool names must match ^[a-zA-Z0-9_-]+$"));
        }

        int toolCount = options.getTools().size();
        if (toolCount > hardToolLimit) {
            return ValidationResult.invalid("Tool limit exceeded (" + toolCount + "/" + hardToolLimit + "). "
                    + "Disable " + (toolCount - hardToolLimit) + " tools and retry.");
        }
        return ValidationResult.ok();
    }

    private static boolean isValidName(String name) {
        return name != null && FUNCTION_NAME.matcher(name).matches();
    }

    private static String asUnexpected(String reason) {
        return "Prompt failed validation with the reason: " + reason + ". Please file an issue.";
    }
}
