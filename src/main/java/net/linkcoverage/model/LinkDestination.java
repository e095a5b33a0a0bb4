package net.linkcoverage.model;

public enum LinkDestination {
    HOMEPAGE("homepage"),
    BLOG_PAGE("blog_page"),
    PRODUCT("product"),
    OTHER("other");

    private final String wireValue;

    LinkDestination(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static LinkDestination fromWireValue(String value) {
        for (LinkDestination destination : values()) {
            if (destination.wireValue.equalsIgnoreCase(value)) {
                return destination;
            }
        }
        return OTHER;
    }
}
