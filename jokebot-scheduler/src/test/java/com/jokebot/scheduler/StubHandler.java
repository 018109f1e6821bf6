package com.jokebot.scheduler;

import com.jokebot.scheduler.handler.JobHandler;
import com.jokebot.scheduler.model.JobRecord;
import com.jokebot.scheduler.model.JobResult;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * 记录调用并按给定函数返回结果的测试处理器。
 */
public class StubHandler implements JobHandler {

    private final String name;
    private final Function<JobRecord, JobResult> behavior;
    private final List<String> invokedKeys = new CopyOnWriteArrayList<>();

    public StubHandler(String name, Function<JobRecord, JobResult> behavior) {
        this.name = name;
        this.behavior = behavior;
    }

    @Override
    public String getHandlerName() {
        return name;
    }

    @Override
    public JobResult handle(JobRecord job) {
        invokedKeys.add(job.getKey());
        return behavior.apply(job);
    }

    public List<String> invokedKeys() {
        return invokedKeys;
    }

    public long invocations(String key) {
        return invokedKeys.stream().filter(key::equals).count();
    }
}
