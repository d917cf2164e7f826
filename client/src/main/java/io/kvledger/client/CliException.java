package io.kvledger.client;

/** Bad command line: unknown option, missing argument, unknown command. */
final class CliException extends RuntimeException {
    CliException(String msg) {
        super(msg);
    }
}
