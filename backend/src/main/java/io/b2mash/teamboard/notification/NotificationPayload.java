package io.b2mash.teamboard.notification;

/** Keys understood in the payload of a {@link NotificationSink#notify} call. */
public final class NotificationPayload {

  public static final String FROM_STATUS = "fromStatus";
  public static final String TO_STATUS = "toStatus";
  public static final String COMMENT = "comment";
  public static final String STATUS_CHANGE_ID = "statusChangeId";
  public static final String ROLE = "role";
  public static final String TEXT = "text";
  public static final String SOURCE = "source";

  private NotificationPayload() {}
}
