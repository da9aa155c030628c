package com.epinet.service.core.content;

import java.util.Map;

/**
 * Resolves content ids to human-readable titles. Used for node naming only; a missing title
 * degrades to a placeholder label.
 */
public interface ContentTitleResolver {

    Map<String, String> titlesFor(String tenantId);
}
