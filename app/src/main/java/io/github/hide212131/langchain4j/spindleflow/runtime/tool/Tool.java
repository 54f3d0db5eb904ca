package io.github.hide212131.langchain4j.spindleflow.runtime.tool;

/** A named capability an agent can declare in its {@code tools} list. */
public interface Tool {

    String name();

    String execute(ToolContext context);
}
