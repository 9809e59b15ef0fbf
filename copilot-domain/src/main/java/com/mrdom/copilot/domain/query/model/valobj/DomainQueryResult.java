package com.mrdom.copilot.domain.query.model.valobj;

import com.mrdom.copilot.types.enums.DomainQueryOutcomeEnum;
import com.mrdom.copilot.types.enums.ExternalSourceEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 一次业务查询的汇总结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DomainQueryResult {

    /**
     * 提取到的联系人邮箱，NO_IDENTIFIER 时为 null
     */
    private String email;

    /**
     * 相关来源系统
     */
    private Set<ExternalSourceEnum> sources;

    /**
     * 规整后的事实（含失败事实）
     */
    private List<ExternalFact> facts;

    /**
     * 各来源是否失败
     */
    private Map<ExternalSourceEnum, Boolean> sourceFailures;

    private DomainQueryOutcomeEnum outcome;

    public static DomainQueryResult noIdentifier(Set<ExternalSourceEnum> sources) {
        return DomainQueryResult.builder()
                .sources(sources == null ? Set.of() : Collections.unmodifiableSet(sources))
                .facts(List.of())
                .sourceFailures(Map.of())
                .outcome(DomainQueryOutcomeEnum.NO_IDENTIFIER)
                .build();
    }

    /**
     * 按各来源的失败情况汇总：全部失败为 DEGRADED_NO_DATA，部分失败为 PARTIAL，否则 COMPLETE。
     */
    public static DomainQueryResult aggregate(String email,
                                              Set<ExternalSourceEnum> sources,
                                              Map<ExternalSourceEnum, List<ExternalFact>> factsBySource) {
        List<ExternalFact> facts = new ArrayList<>();
        Map<ExternalSourceEnum, Boolean> failures = new EnumMap<>(ExternalSourceEnum.class);
        int failed = 0;
        for (ExternalSourceEnum source : sources) {
            List<ExternalFact> sourceFacts = factsBySource.getOrDefault(source, List.of());
            boolean sourceFailed = sourceFacts.isEmpty() || sourceFacts.stream().anyMatch(ExternalFact::error);
            failures.put(source, sourceFailed);
            if (sourceFailed) {
                failed++;
            }
            facts.addAll(sourceFacts);
        }
        DomainQueryOutcomeEnum outcome;
        if (failed == 0) {
            outcome = DomainQueryOutcomeEnum.COMPLETE;
        } else if (failed == sources.size()) {
            outcome = DomainQueryOutcomeEnum.DEGRADED_NO_DATA;
        } else {
            outcome = DomainQueryOutcomeEnum.PARTIAL;
        }
        return DomainQueryResult.builder()
                .email(email)
                .sources(Collections.unmodifiableSet(sources))
                .facts(List.copyOf(facts))
                .sourceFailures(Collections.unmodifiableMap(failures))
                .outcome(outcome)
                .build();
    }

    public List<ExternalSourceEnum> getFailedSources() {
        List<ExternalSourceEnum> failed = new ArrayList<>();
        if (sourceFailures == null) {
            return failed;
        }
        sourceFailures.forEach((source, isFailed) -> {
            if (Boolean.TRUE.equals(isFailed)) {
                failed.add(source);
            }
        });
        return failed;
    }

    public long getErrorFactCount() {
        return facts == null ? 0L : facts.stream().filter(ExternalFact::error).count();
    }
}
