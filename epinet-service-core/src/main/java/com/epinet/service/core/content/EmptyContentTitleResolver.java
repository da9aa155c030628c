package com.epinet.service.core.content;

import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Default resolver when no content map service is wired. Register a {@code @Primary} resolver to
 * supply real titles.
 */
@Component
public class EmptyContentTitleResolver implements ContentTitleResolver {

    @Override
    public Map<String, String> titlesFor(String tenantId) {
        return Map.of();
    }
}
