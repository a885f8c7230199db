package io.github.pyrox.ladder;

public class BranchNotFoundException extends LadderException {
    private final int branchId;

    public BranchNotFoundException(int branchId) {
        super("Branch " + branchId + " not found in rung");
        this.branchId = branchId;
    }

    public int branchId() {
        return branchId;
    }
}
