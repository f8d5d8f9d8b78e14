package com.filetags.app.database;

public class DuplicateTagNameException extends StorageException {

    private final String tagName;

    public DuplicateTagNameException(String tagName, Throwable cause) {
        super("Tag já existe: " + tagName, cause);
        this.tagName = tagName;
    }

    public String tagName() {
        return tagName;
    }
}
