package io.sessionvault.recovery;

import io.sessionvault.checkpoint.CheckpointManager;
import io.sessionvault.model.Checkpoint;
import io.sessionvault.model.CheckpointType;

public interface RecoveryHost {
    Checkpoint createCheckpoint(CheckpointType type);

    CheckpointManager.RestoreSummary restoreFromCheckpoint(String checkpointId);
}
