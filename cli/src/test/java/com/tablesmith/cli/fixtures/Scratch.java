package com.tablesmith.cli.fixtures;

public class Scratch {
    private String note;
}
