package com.ethnicthv.enumset.demo;

import com.ethnicthv.enumset.core.annotation.CLike;

@CLike
public enum Permission {
    READ, WRITE, EXECUTE, DELETE, ADMIN
}
