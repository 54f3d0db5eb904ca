package io.github.hide212131.langchain4j.spindleflow.runtime.prompt;

import java.util.Objects;

/** A system/user message pair ready for the model. */
public record Prompt(String system, String user) {

    public Prompt {
        Objects.requireNonNull(system, "system");
        Objects.requireNonNull(user, "user");
    }
}
