package uk.gegc.diagnosis.features.questionbank.infra;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.diagnosis.features.questionbank.application.KnowledgePointCatalog;
import uk.gegc.diagnosis.features.questionbank.domain.repository.KnowledgePointRepository;

import java.util.Collection;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class JpaKnowledgePointCatalog implements KnowledgePointCatalog {

    private final KnowledgePointRepository knowledgePointRepository;

    @Override
    @Transactional(readOnly = true)
    public Map<String, KnowledgePointInfo> describe(Collection<String> knowledgePointIds) {
        if (knowledgePointIds == null || knowledgePointIds.isEmpty()) {
            return Map.of();
        }
        return knowledgePointRepository.findAllById(knowledgePointIds).stream()
                .map(kp -> new KnowledgePointInfo(kp.getId(), kp.getName(), kp.getPrerequisiteIds().stream().sorted().toList()))
                .collect(Collectors.toMap(KnowledgePointInfo::id, Function.identity()));
    }
}
