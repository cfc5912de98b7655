package com.librarylogs.ezproxy.output;

/**
 * Column types that differ between the production SQL Server and the
 * embedded database used in tests.
 */
public enum SqlDialect {

    SQLSERVER("BIT", "DATETIME2(0)", "NVARCHAR(MAX)", "NVARCHAR(1024)"),
    HSQLDB("BOOLEAN", "TIMESTAMP(0)", "LONGVARCHAR", "VARCHAR(1024)");

    private final String booleanType;
    private final String timestampType;
    private final String textType;
    private final String shortTextType;

    SqlDialect(String booleanType, String timestampType, String textType, String shortTextType) {
        this.booleanType = booleanType;
        this.timestampType = timestampType;
        this.textType = textType;
        this.shortTextType = shortTextType;
    }

    public String booleanType() {
        return booleanType;
    }

    public String timestampType() {
        return timestampType;
    }

    public String textType() {
        return textType;
    }

    public String shortTextType() {
        return shortTextType;
    }
}
