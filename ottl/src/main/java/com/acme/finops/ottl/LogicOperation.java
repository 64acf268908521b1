package com.acme.finops.ottl;

public enum LogicOperation {
    AND,
    OR
}
