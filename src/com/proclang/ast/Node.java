package com.proclang.ast;

public interface Node {
    String getType();
}
