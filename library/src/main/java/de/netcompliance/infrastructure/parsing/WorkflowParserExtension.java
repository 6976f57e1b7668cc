package de.netcompliance.infrastructure.parsing;

public interface WorkflowParserExtension {

    WorkflowParseResult readLocation(final String workflowUrl, final WorkflowParseOptions options);
    WorkflowParseResult readContents(final String workflowAsString, final WorkflowParseOptions options);
}
