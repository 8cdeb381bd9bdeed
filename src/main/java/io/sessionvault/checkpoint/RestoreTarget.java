package io.sessionvault.checkpoint;

import io.sessionvault.model.Task;
import io.sessionvault.model.TaskQueue;
import io.sessionvault.transaction.Transaction;

public interface RestoreTarget {
    void clearCurrentState(Transaction tx);

    void restoreTask(Task task, Transaction tx);

    void restoreQueue(TaskQueue queue, Transaction tx);
}
