package com.example.menuimport.worker;

@FunctionalInterface
public interface ImportMessageListener {
    void onMessage(ImportMessage message);
}
