package com.ryuqq.asms.core.registry;

import com.ryuqq.asms.core.contract.Command;
import com.ryuqq.asms.core.contract.Query;
import com.ryuqq.asms.core.contract.Resource;
import com.ryuqq.asms.core.contract.ResourceFactory;

import java.util.List;

/**
 * 한 도메인의 Unit과 Resource 묶음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DomainModule {

    String domain();

    List<Command> commands();

    List<Query> queries();

    List<Resource> resources();

    List<ResourceFactory> resourceFactories();

    /**
     * 모든 구성요소를 레지스트리에 등록.
     *
     * @param registry 대상 레지스트리
     */
    default void registerInto(UnitRegistry registry) {
        commands().forEach(registry::registerCommand);
        queries().forEach(registry::registerQuery);
        resources().forEach(registry::registerResource);
        resourceFactories().forEach(registry::registerFactory);
    }
}
