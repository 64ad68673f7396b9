package com.phonepe.triplestore.core.query;

/**
 * Direction of the observed_at ordering applied to structured queries
 */
public enum SortOrder {
    ASC,
    DESC
}
