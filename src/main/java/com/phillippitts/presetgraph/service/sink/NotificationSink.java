package com.phillippitts.presetgraph.service.sink;

/** Shows the small "copied" badge after an automatic copy. */
public interface NotificationSink {

    enum Badge { TEXT_COPIED, IMAGE_COPIED }

    /**
     * @param badge   which badge to show
     * @param preview copied text for {@link Badge#TEXT_COPIED}, otherwise empty
     */
    void copied(Badge badge, String preview);
}
