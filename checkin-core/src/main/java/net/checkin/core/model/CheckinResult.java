package net.checkin.core.model;

public record CheckinResult(boolean success, String message) {
    public static CheckinResult ok(String message) { return new CheckinResult(true, message); }
    public static CheckinResult failed(String message) { return new CheckinResult(false, message); }

    /** Failed result describing an executor fault; the message is never blank. */
    public static CheckinResult fault(Throwable t) {
        String msg = t.getMessage();
        String desc = t.getClass().getSimpleName();
        return failed(msg == null || msg.isBlank() ? desc : desc + ": " + msg);
    }
}
