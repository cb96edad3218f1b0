package model;

import java.util.List;

public record Scene(String id, String title, String transition, DeviceType device, List<Element> elements) {

    public static final String DEFAULT_ID = "main";
    public static final String DEFAULT_TRANSITION = "none";

    public Scene {
        elements = List.copyOf(elements);
    }
}
