package com.calcroom.app;

import javafx.application.Application;

// starts from the plain classpath without the JavaFX module path
public final class Launcher {

    private Launcher() {}

    public static void main(String[] args) {
        Application.launch(CalculatorApp.class, args);
    }
}
