package com.flavorsnap.backend.common.error;

public class VotingClosedException extends PipelineException {

    public VotingClosedException(String submissionId, String status) {
        super(ErrorKind.VOTING_CLOSED, "VOTING_CLOSED",
                "Category " + submissionId + " is not open for voting (status=" + status + ")");
    }
}
