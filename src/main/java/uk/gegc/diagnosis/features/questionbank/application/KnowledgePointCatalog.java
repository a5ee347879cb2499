package uk.gegc.diagnosis.features.questionbank.application;

import java.util.Collection;
import java.util.List;
import java.util.Map;

public interface KnowledgePointCatalog {

    /**
     * Looks up names and declared prerequisites. Unknown ids are absent from the result.
     */
    Map<String, KnowledgePointInfo> describe(Collection<String> knowledgePointIds);

    record KnowledgePointInfo(String id, String name, List<String> prerequisiteIds) {
    }
}
