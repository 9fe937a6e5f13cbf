package com.memfacade.service;

public enum ErrorKind {
    NOT_FOUND,
    INVALID_ARGUMENT,
    CREATE_FAILED,
    UPDATE_FAILED,
    DELETE_FAILED,
    INTERNAL_ERROR
}
