package com.collab.service;

public interface IdGenerator {
    String nextId();
}
