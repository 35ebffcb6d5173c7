package app.fsidrill.srs.review.graduation;

import app.fsidrill.srs.review.domain.DrillDefinition;
import app.fsidrill.srs.review.domain.DrillMeta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Side table of {@code id -> (pattern group, canonical)}. Canonical uniqueness per group is expected
 * from the input and not re-derived here.
 */
@Component
public class DrillMetaRegistry {

    private static final Logger log = LoggerFactory.getLogger(DrillMetaRegistry.class);

    private final Map<String, DrillMeta> meta = new HashMap<>();

    public int load(Collection<DrillDefinition> definitions) {
        if (definitions == null) {
            return 0;
        }
        int loaded = 0;
        for (DrillDefinition definition : definitions) {
            if (definition == null || definition.id() == null || definition.id().isBlank()) {
                continue;
            }
            meta.put(definition.id(), DrillMeta.from(definition));
            loaded++;
        }
        log.info("Loaded drill metadata for {} drills ({} pattern groups)", loaded, patternGroups().size());
        return loaded;
    }

    public Optional<DrillMeta> find(String id) {
        return Optional.ofNullable(meta.get(id));
    }

    public boolean isCanonical(String id) {
        DrillMeta m = meta.get(id);
        return m != null && m.canonical();
    }

    public void setCanonical(String id, boolean canonical) {
        meta.computeIfPresent(id, (k, m) -> m.withCanonical(canonical));
    }

    public boolean inGroup(String id, String patternGroup) {
        DrillMeta m = meta.get(id);
        return m != null && patternGroup != null && patternGroup.equals(m.patternGroup());
    }

    public Set<String> patternGroups() {
        Set<String> groups = new TreeSet<>();
        for (DrillMeta m : meta.values()) {
            if (m.grouped()) groups.add(m.patternGroup());
        }
        return groups;
    }
}
