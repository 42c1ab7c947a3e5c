package net.checkin.core.model;

public record AccountRef(long id, String name) {
    @Override public String toString() { return name + "#" + id; }
}
