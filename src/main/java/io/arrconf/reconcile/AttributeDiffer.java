package io.arrconf.reconcile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.arrconf.model.AttributeChange;
import io.arrconf.model.ResourceDiff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public final class AttributeDiffer {
    private static final Logger log = LoggerFactory.getLogger(AttributeDiffer.class);

    public ResourceDiff diff(
            String resource,
            List<AttributeMapping> mappings,
            JsonNode localSection,
            JsonNode remote,
            ObjectNode payload
    ) {
        List<AttributeChange> changes = new ArrayList<>();
        for (AttributeMapping mapping : mappings) {
            String path = resource + "." + mapping.key();
            try {
                JsonNode localRaw = mapping.readLocal(localSection);
                if (localRaw.isMissingNode()) {
                    if (log.isDebugEnabled()) {
                        log.debug("{}: {} (unmanaged)", path, mapping.readRemote(remote));
                    }
                    continue;
                }
                JsonNode local = mapping.canonical(localRaw);
                JsonNode current = mapping.canonical(mapping.readRemote(remote));
                if (mapping.matches(local, current)) {
                    log.debug("{}: {} (up to date)", path, current);
                    continue;
                }
                log.debug("{}: {} -> {} (pending)", path, current, local);
                changes.add(new AttributeChange(path, current, local));
                mapping.render(payload, local);
            } catch (AttributeMappingException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new AttributeMappingException(path, e.getMessage(), e);
            }
        }
        return new ResourceDiff(resource, changes, payload);
    }
}
