package com.urlsentry.app.cli;

/** 잘못된 명령행 인자 */
public class UsageException extends Exception {
    public UsageException(String message) { super(message); }
}
