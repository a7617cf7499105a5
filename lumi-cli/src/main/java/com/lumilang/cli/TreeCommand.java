package com.lumilang.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * picocli tree 子命令：以 JSON 输出语法树
 */
@Command(name = "tree", description = "以 JSON 输出源码文件的 Form 树")
public class TreeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "源码文件路径")
    String file;

    @Option(names = "--pretty", description = "缩进输出")
    boolean pretty;

    @Option(names = "--locations", description = "包含源码位置")
    boolean locations;

    @Override
    public Integer call() {
        return new SourceRunner(System.out, System.err).dumpTree(file, pretty, locations);
    }
}
