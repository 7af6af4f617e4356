package ippnotify.netty;

public class Constants {

    public static final String ERR_WRITING_RESPONSE = "Error writing response to pipeline: {}";
    public static final String JSON_TYPE = "application/json";
    public static final String LOG_RETURNING_RESPONSE = "Returning response {}";

    public static final String SYSTEM_PATH = "/ipp/system";
    public static final String PRINTER_PATH_PREFIX = "/ipp/print/";

    private Constants() {}
}
