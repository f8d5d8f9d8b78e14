package com.filetags.app;

import com.filetags.app.cli.TagCli;

public final class Main {

    private Main() {}

    public static void main(String[] args) {
        TagCli.run(args);
    }
}
