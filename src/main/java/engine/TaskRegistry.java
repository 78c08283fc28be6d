package engine;

import model.bo.TaskRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 呼梯任务登记表
 * 进行中的任务按任务ID登记；结束后移入有界的历史表，供状态轮询。
 * 查询不加调度器全局锁。
 */
public class TaskRegistry {

    private final Map<String, TaskRecord> active = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<TaskRecord>> completions = new ConcurrentHashMap<>();
    private final Map<String, TaskRecord> history;

    public TaskRegistry(int historyCapacity) {
        int capacity = Math.max(1, historyCapacity);
        this.history = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, TaskRecord> eldest) {
                return size() > capacity;
            }
        });
    }

    /**
     * 登记一个进行中的任务
     *
     * @return 任务结束时完成的 future
     */
    public CompletableFuture<TaskRecord> register(TaskRecord record) {
        CompletableFuture<TaskRecord> completion = new CompletableFuture<>();
        completions.put(record.getTaskId(), completion);
        active.put(record.getTaskId(), record);
        return completion;
    }

    /**
     * 撤销登记（预占回滚时使用）
     */
    public void unregister(String taskId) {
        active.remove(taskId);
        CompletableFuture<TaskRecord> completion = completions.remove(taskId);
        if (completion != null) {
            completion.cancel(false);
        }
    }

    /**
     * 任务进入终态，只对仍在进行中的任务生效
     * 先写历史再移出进行中，保证并发查询总能看到其中之一
     *
     * @return false 表示任务已经结束或未登记，本次不做任何修改
     */
    public synchronized boolean finish(TaskRecord terminal) {
        String taskId = terminal.getTaskId();
        if (!active.containsKey(taskId)) {
            return false;
        }
        history.put(taskId, terminal);
        active.remove(taskId);
        CompletableFuture<TaskRecord> completion = completions.remove(taskId);
        if (completion != null) {
            completion.complete(terminal);
        }
        return true;
    }

    /**
     * 某台电梯上所有进行中的任务
     */
    public List<TaskRecord> activeOn(int elevatorId) {
        return active.values().stream()
                .filter(t -> t.getElevatorId() != null && t.getElevatorId() == elevatorId)
                .collect(Collectors.toList());
    }

    /**
     * 查询任务，未登记或已清理的任务按约定视为已完成
     */
    public TaskRecord find(String taskId) {
        TaskRecord record = active.get(taskId);
        if (record != null) {
            return record;
        }
        record = history.get(taskId);
        if (record != null) {
            return record;
        }
        return TaskRecord.untracked(taskId);
    }

    /**
     * 任务结束信号；已结束或未知的任务立即完成
     */
    public CompletableFuture<TaskRecord> completion(String taskId) {
        CompletableFuture<TaskRecord> completion = completions.get(taskId);
        if (completion != null) {
            return completion;
        }
        return CompletableFuture.completedFuture(find(taskId));
    }

    public int activeCount() {
        return active.size();
    }
}
