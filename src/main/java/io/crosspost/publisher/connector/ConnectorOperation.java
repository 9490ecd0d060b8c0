package io.crosspost.publisher.connector;

public enum ConnectorOperation {
    LIST("list articles"),
    GET("get article"),
    CREATE("create article"),
    UPDATE("update article"),
    DELETE("delete article");

    private final String description;

    ConnectorOperation(String description) {
        this.description = description;
    }

    @Override
    public String toString() {
        return description;
    }
}
