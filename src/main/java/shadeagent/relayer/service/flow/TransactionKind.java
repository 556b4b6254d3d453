package shadeagent.relayer.service.flow;

public enum TransactionKind {
    SWAP("swap"),
    LENDING_DEPOSIT("lending-deposit"),
    LENDING_WITHDRAW("lending-withdraw"),
    TRANSFER("transfer");

    private final String pathSegment;

    TransactionKind(String pathSegment) {
        this.pathSegment = pathSegment;
    }

    public String getPathSegment() {
        return pathSegment;
    }
}
