package com.ownding.protect.resource;

/**
 * Projects a resource onto one CSV row. The matching header lives on the {@link ResourceKind}.
 */
public interface CsvConvertible {

    String csvRow();
}
