package com.filetags.app.database;

/**
 * Falha do próprio backend de persistência (disco cheio, arquivo travado,
 * banco corrompido). Aborta somente a operação em andamento.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
