package com.jokebot.scheduler.handler;

import com.jokebot.common.exception.NotFoundException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 按名称查找任务处理器。
 */
@Component
public class JobHandlerRegistry {

    private final Map<String, JobHandler> handlers = new LinkedHashMap<>();

    public JobHandlerRegistry(List<JobHandler> handlers) {
        for (JobHandler handler : handlers) {
            JobHandler previous = this.handlers.put(handler.getHandlerName(), handler);
            if (previous != null) {
                throw new IllegalStateException("处理器名称重复: " + handler.getHandlerName());
            }
        }
    }

    public JobHandler get(String handlerName) {
        JobHandler handler = handlers.get(handlerName);
        if (handler == null) {
            throw new NotFoundException("未找到任务处理器: " + handlerName + "，可选: " + handlers.keySet());
        }
        return handler;
    }

    public boolean has(String handlerName) {
        return handlers.containsKey(handlerName);
    }
}
