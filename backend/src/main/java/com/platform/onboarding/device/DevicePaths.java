package com.platform.onboarding.device;

/**
 * Device management API paths used outside the schema table.
 */
public final class DevicePaths {
    
    public static final String DEVICE_INFO = "/shared/identified-devices/config/device-info";
    public static final String CM_DEVICE = "/tm/cm/device";
    public static final String UPLOADS = "/shared/file-transfer/uploads";
    public static final String DOWNLOADS_DIR = "/var/config/rest/downloads";
    public static final String UNIX_RM = "/tm/util/unix-rm";
    public static final String SSL_CERT = "/tm/sys/file/ssl-cert";
    public static final String SSL_KEY = "/tm/sys/file/ssl-key";
    public static final String PROVISION = "/tm/sys/provision";
    
    public static final String AUTH_SOURCE = "/tm/auth/source";
    public static final String AUTH_REMOTE_USER = "/tm/auth/remote-user";
    public static final String AUTH_REMOTE_ROLE = "/tm/auth/remote-role/role-info";
    public static final String AUTH_RADIUS = "/tm/auth/radius";
    public static final String AUTH_RADIUS_SERVER = "/tm/auth/radius-server";
    public static final String AUTH_TACACS = "/tm/auth/tacacs";
    public static final String AUTH_LDAP = "/tm/auth/ldap";
    
    private DevicePaths() {
    }
    
    public static String commonObject(String collection, String name) {
        return collection + "/~Common~" + name;
    }
}
