package com.mrdom.copilot.test.support;

import com.mrdom.copilot.domain.agent.adapter.gateway.ITextCompletionGateway;
import com.mrdom.copilot.domain.agent.model.valobj.ModelParameters;
import com.mrdom.copilot.domain.memory.model.valobj.ContextPackage;

import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * 记录调用参数的文本生成网关。
 */
public class ScriptedCompletionGateway implements ITextCompletionGateway {

    private final Function<ContextPackage, String> fallback;
    private final Deque<Function<ContextPackage, String>> script = new ConcurrentLinkedDeque<>();
    private final List<ContextPackage> contexts = new CopyOnWriteArrayList<>();
    private final List<String> systemPrompts = new CopyOnWriteArrayList<>();

    public ScriptedCompletionGateway(String reply) {
        this(context -> reply);
    }

    public ScriptedCompletionGateway(Function<ContextPackage, String> fallback) {
        this.fallback = fallback;
    }

    public static Function<ContextPackage, String> failing(String message) {
        return context -> {
            throw new IllegalStateException(message);
        };
    }

    public ScriptedCompletionGateway then(Function<ContextPackage, String> step) {
        script.add(step);
        return this;
    }

    @Override
    public String complete(ContextPackage context, String systemPrompt, ModelParameters parameters) {
        contexts.add(context);
        systemPrompts.add(systemPrompt);
        Function<ContextPackage, String> step = script.poll();
        return (step == null ? fallback : step).apply(context);
    }

    public int calls() {
        return contexts.size();
    }

    public ContextPackage lastContext() {
        return contexts.get(contexts.size() - 1);
    }

    public String lastSystemPrompt() {
        return systemPrompts.get(systemPrompts.size() - 1);
    }
}
