package com.labpulse.notification;

/**
 * Delivers triggered alerts to the outside world.
 */
public interface Notifier {

    /**
     * @param notification alert to deliver
     * @throws NotificationException if delivery fails
     */
    void send(Notification notification);
}
