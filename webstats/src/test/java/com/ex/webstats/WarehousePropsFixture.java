package com.ex.webstats;

public final class WarehousePropsFixture {
    private WarehousePropsFixture(){}

    public static final String PROJECT = "test-project";
    public static final String EVENT = "`test-project.umami_views.event`";
    public static final String SESSION = "`test-project.umami_views.session`";

    public static WarehouseProps props() {
        WarehouseProps props = new WarehouseProps();
        props.setProjectId(PROJECT);
        return props;
    }
}
