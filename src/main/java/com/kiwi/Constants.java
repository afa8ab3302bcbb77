package com.kiwi;

public final class Constants {
    public static final String FIG_KIWI_MAGIC = "fig-kiwi";
    public static final String FIG_KIWIE_MAGIC = "fig-kiwie";
    public static final String FIG_JAM_MAGIC = "fig-jam.";
    public static final int PRELUDE_BYTES = 8;
    public static final int CHUNK_ALIGNMENT = 4;
    public static final int MAX_CHUNKS = 3;
    public static final String ROOT_MESSAGE_TYPE = "Message";
    public static final int DEFAULT_BUFFER_CAPACITY = 256;
    public static final int MAX_NESTING_DEPTH = 256;
    public static final int MAX_ZERO_WIDTH_ARRAY_LENGTH = 1 << 16;

    private Constants() {}
}
