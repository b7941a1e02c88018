package com.gitagent.server.assistant;

/**
 * Prompt templates for the two assistant calls. Both ask the model for a JSON object and
 * describe the script commands {@code DslInterpreter} understands.
 */
final class AssistantPrompts {

    private AssistantPrompts() {}

    static String changeSummary(String status) {
        return CHANGE_SUMMARY_PROMPT.replace("{{STATUS}}", status);
    }

    static String chat(String message, String status, String log) {
        return CHAT_PROMPT
                .replace("{{STATUS}}", status)
                .replace("{{LOG}}", log)
                .replace("{{MESSAGE}}", message);
    }

    // ------------------------------------------------------------------
    // Templates
    // ------------------------------------------------------------------

    private static final String COMMANDS = """
               - `cd <path>`
               - `repo`
               - `status`
               - `commit "<message>"`
               - `push "<message>"` (optional message; if given, commits before pushing)
               - `pull`
               - `deploy "<command>"`
               - `undo`
               - `log <limit>`
            """;

    private static final String CHANGE_SUMMARY_PROMPT = """
            You are a Git Assistant. Here is the current `git status --porcelain` output of a repository:

            {{STATUS}}

            1. Provide a concise summary of what has changed.
            2. Generate a DSL script to commit these changes. The DSL supports:
            """ + COMMANDS + """

            Return the response in JSON format with keys: "summary" and "dsl".
            Example JSON:
            {
                "summary": "Modified login page and added new icon.",
                "dsl": "commit \\"Update login page\\""
            }
            """;

    private static final String CHAT_PROMPT = """
            You are a helpful Git Assistant.

            Current Git Status:
            {{STATUS}}

            Recent Commit Log:
            {{LOG}}

            User Message: "{{MESSAGE}}"

            1. Respond to the user's message in a helpful way.
            2. If the user asks to perform a git operation (like commit, push, etc.), generate a DSL script to do it.

            The DSL supports:
            """ + COMMANDS + """

            Return JSON format:
            {
                "response": "Sure, I can help with that...",
                "dsl": "commit \\"message\\"" (optional, null if no action needed)
            }
            """;
}
