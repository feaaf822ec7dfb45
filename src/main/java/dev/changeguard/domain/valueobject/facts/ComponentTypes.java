package dev.changeguard.domain.valueobject.facts;

/** Component type keys as sent by the ticketing platform in {@code component_type}. */
public final class ComponentTypes {

    public static final String CATALOG_ITEM = "catalog_item";
    public static final String LDAP_SERVER = "ldap_server";
    public static final String MID_SERVER = "mid_server";
    public static final String WORKFLOW = "workflow";
    public static final String CMDB_CI = "cmdb_ci";
    public static final String STD_CHANGE_TEMPLATE = "std_change_template";

    private ComponentTypes() {
    }
}
