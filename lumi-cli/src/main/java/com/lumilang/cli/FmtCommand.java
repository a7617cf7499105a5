package com.lumilang.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * picocli fmt 子命令：读取源码文件并按规范格式输出
 */
@Command(name = "fmt", description = "读取源码文件，每个顶层 Form 输出一行")
public class FmtCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "源码文件路径")
    String file;

    @Option(names = "--canonical", description = "只输出规范调用形式，不使用缩写")
    boolean canonical;

    @Option(names = {"-w", "--write"}, description = "把结果写回源文件")
    boolean write;

    @Override
    public Integer call() {
        return new SourceRunner(System.out, System.err).formatFile(file, canonical, write);
    }
}
