package com.minimember.domain.planner;

import com.minimember.common.concurrent.Futures;
import com.minimember.common.exception.MembershipException;
import com.minimember.gateway.timer.TimerService;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;

/**
 * 按顺序执行一个 {@link TransitionPlan}。
 *
 * <p>状态：AWAITING_REMOTE -> (AWAITING_DELAY -> AWAITING_REMOTE)* -> DONE | FAILED。
 * 每一步先做本地预生效，再发远端；远端失败只撤销这一步，后续步骤不再执行，已确认的步骤保留。
 * 下一步只在上一步确认之后，经过 {@link PlanStep#delayBefore()} 再发出。</p>
 */
@Slf4j
public class PlanExecution {

    public enum State {
        AWAITING_REMOTE,
        AWAITING_DELAY,
        DONE,
        FAILED
    }

    /**
     * 每一步具体怎么预生效、怎么发远端、怎么撤销，由协调器提供。
     */
    public interface StepHandler {

        SpeculativeChange apply(PlanStep step);

        CompletableFuture<Void> send(PlanStep step);

        void revert(SpeculativeChange change);
    }

    private final TransitionPlan plan;
    private final StepHandler handler;
    private final TimerService timers;
    private final Executor worker;
    private final BooleanSupplier running;
    private final CompletableFuture<Void> result = new CompletableFuture<>();

    private volatile State state;
    private volatile int stepIndex;

    public PlanExecution(TransitionPlan plan, StepHandler handler, TimerService timers, Executor worker, BooleanSupplier running) {
        this.plan = plan;
        this.handler = handler;
        this.timers = timers;
        this.worker = worker;
        this.running = running;
    }

    public CompletableFuture<Void> start() {
        if (plan.isNoOp()) {
            state = State.DONE;
            result.complete(null);
            return result;
        }
        runStep(0);
        return result;
    }

    public State state() {
        return state;
    }

    public int stepIndex() {
        return stepIndex;
    }

    private void runStep(int index) {
        if (!running.getAsBoolean()) {
            fail(MembershipException.closing());
            return;
        }
        stepIndex = index;
        state = State.AWAITING_REMOTE;
        PlanStep step = plan.steps().get(index);
        SpeculativeChange change;
        try {
            change = handler.apply(step);
        } catch (RuntimeException e) {
            log.error("plan step apply failed: step={}/{}, type={}", index + 1, plan.steps().size(), step.type(), e);
            fail(e);
            return;
        }
        CompletableFuture<Void> sent;
        try {
            sent = handler.send(step);
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }
        sent.whenCompleteAsync((ignored, err) -> onStepCompleted(index, change, err), worker);
    }

    private void onStepCompleted(int index, SpeculativeChange change, Throwable err) {
        if (!running.getAsBoolean()) {
            // 关闭中：丢弃结果，不再动缓存
            fail(MembershipException.closing());
            return;
        }
        if (err != null) {
            Throwable cause = Futures.unwrap(err);
            log.debug("plan step failed: step={}/{}, type={}, err={}",
                    index + 1, plan.steps().size(), plan.steps().get(index).type(), cause.toString());
            handler.revert(change);
            fail(cause);
            return;
        }
        int next = index + 1;
        if (next >= plan.steps().size()) {
            state = State.DONE;
            result.complete(null);
            return;
        }
        PlanStep nextStep = plan.steps().get(next);
        if (!nextStep.delayed()) {
            runStep(next);
            return;
        }
        state = State.AWAITING_DELAY;
        timers.scheduleOnce(nextStep.delayBefore(), () -> runStep(next));
    }

    private void fail(Throwable cause) {
        state = State.FAILED;
        result.completeExceptionally(cause);
    }
}
