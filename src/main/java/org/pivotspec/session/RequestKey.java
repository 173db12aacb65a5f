package org.pivotspec.session;

/**
 * Identity of a cancellable lookup: a newer request with the same key supersedes an older one.
 *
 * @param field        field the lookup is for
 * @param widgetId     widget being edited, may be null
 * @param datasourceId datasource, may be null
 */
public record RequestKey(String field, String widgetId, String datasourceId) {
}
