package io.b2mash.teamboard.notification;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param mentionContextLength characters kept on each side of an {@code @mention} in the excerpt
 *     shown to the mentioned member
 * @param fallbackExcerptLength length of the excerpt used when the mention cannot be located
 * @param taskLinkPrefix front-end path prefix for task links stored on notifications
 */
@ConfigurationProperties(prefix = "teamboard.notifications")
public record NotificationProperties(
    int mentionContextLength, int fallbackExcerptLength, String taskLinkPrefix) {

  public NotificationProperties {
    if (mentionContextLength <= 0) {
      mentionContextLength = 50;
    }
    if (fallbackExcerptLength <= 0) {
      fallbackExcerptLength = 100;
    }
    if (taskLinkPrefix == null || taskLinkPrefix.isBlank()) {
      taskLinkPrefix = "/tasks/";
    }
  }

  public String taskLink(Object taskId) {
    return taskLinkPrefix + taskId;
  }
}
