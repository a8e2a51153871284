package com.aigreentick.services.dealership.queue.service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.aigreentick.services.dealership.queue.enums.JobType;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
public class JobHandlerRegistry {

    private final Map<JobType, JobHandler<?>> handlers = new EnumMap<>(JobType.class);

    public JobHandlerRegistry(List<JobHandler<?>> handlerBeans) {
        for (JobHandler<?> handler : handlerBeans) {
            JobHandler<?> previous = handlers.put(handler.type(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for job type " + handler.type().getCode()
                        + ": " + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }
        log.info("Registered {} job handlers: {}", handlers.size(), handlers.keySet());
    }

    public Optional<JobHandler<?>> find(JobType type) {
        return Optional.ofNullable(handlers.get(type));
    }
}
