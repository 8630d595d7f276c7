package com.example.aspects.authority;

/** An intent in transit, tagged with the participant that sent it. */
public record Envelope(String senderId, Intent intent) {
}
