package offlinecache.domain.storage;

public enum HandleKind {
    FILE,
    DIRECTORY
}
