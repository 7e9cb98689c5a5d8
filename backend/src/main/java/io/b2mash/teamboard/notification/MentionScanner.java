package io.b2mash.teamboard.notification;

import java.util.Set;
import java.util.UUID;

/** Resolves {@code @name} and {@code @{full name}} tokens in free text to member ids. */
public interface MentionScanner {

  Set<UUID> scan(String text);
}
