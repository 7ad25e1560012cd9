package utils;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import init.Config;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class Log {

    // one logger per calling class, shared by every thread
    private static final Map<String, Logger> loggers = new ConcurrentHashMap<>();

    public static void info(String message) {
        getLogger().info(message);
    }

    public static void debug(String message) {
        Logger logger = getLogger();
        if (logger.isDebugEnabled()) {
            logger.debug(message);
        }
    }

    public static void error(String message) {
        StackTraceElement caller = new Throwable().getStackTrace()[1];
        getLogger().error(caller.getClassName() + "." + caller.getMethodName()
                + "(" + caller.getFileName() + ":" + caller.getLineNumber() + ") " + message);
    }

    public static void errorStack(String message, Exception e) {
        getLogger().error(message, e);
    }

    public static void warn(String message) {
        getLogger().warn(message);
    }

    // resolves the class that called into Log
    private static Logger getLogger() {
        String callingClassName = new Throwable().getStackTrace()[2].getClassName();
        return loggers.computeIfAbsent(callingClassName, LogManager::getLogger);
    }

    public static void printTime(String message, long startTime) {
        long endTime = System.currentTimeMillis();
        getLogger().info(message + "  " + (endTime - startTime) + "ms");
    }

    public static void setLogLevel(String level) {
        Configurator.setLevel(LogManager.getRootLogger().getName(), Level.toLevel(level));
    }

    public static void initLogLevel() {
        setLogLevel(Config.logLevel);
    }
}
