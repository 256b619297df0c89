package io.netnotes.fastscroll.utils;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

public class LoggingHelpers {
    public enum LogLevel{
        NONE(0),
        GENERAL(1),
        HIGH_PRIORITY(2),
        ERROR(3),
        ALL(4);

        private final int value;

        private LogLevel(int value) {
            this.value = value;
        }

        public int getValue() {
            return this.value;
        }

        public static LogLevel fromName(String name, LogLevel fallback){
            if(name == null){
                return fallback;
            }
            for(LogLevel level : values()){
                if(level.name().equalsIgnoreCase(name)){
                    return level;
                }
            }
            return fallback;
        }
    }

    public static class Log {
        public static String logDirName = "logs";
        public static File logDir = new File(logDirName);
        public static String logName = "fastscroll";
        public static String logExt = ".txt";

        private static final File logFile = createTimedLogFile();

        // all writes go through one thread so lines never interleave
        private static final SerializedExecutor logExecutor = new SerializedExecutor("FastScroll-Log");

        private static final long LOG_TIMEOUT_MS = 2000;

        private static volatile int logLevel = LogLevel.ALL.getValue();

        public static File createTimedLogFile() {
            return createTimedLogFile(logName);
        }

        public static File createTimedLogFile(String name){
            try{
                Files.createDirectories(logDir.toPath());
                return new File(logDir.getAbsolutePath() + "/" + name + "-" + TimeHelpers.formatDate(System.currentTimeMillis()) + logExt);
            }catch(IOException e){
                return new File(name + "-" + TimeHelpers.formatDate(System.currentTimeMillis()) + logExt);
            }
        }

        public static void setLogLevel(LogLevel logLevel){
            setLogLevel(logLevel.getValue());
        }

        public static void setLogLevel(int level){
            Log.logLevel = level;
        }

        public static int getLogLevel(){
            return logLevel;
        }

        public static CompletableFuture<Void> log(String scope, String msg, LogLevel level) {
            return enqueue(level.getValue(), () ->
                write(scope + ": " + msg)
            );
        }

        public static CompletableFuture<Void> logError(String msg) {
            return enqueue(LogLevel.ERROR.getValue(), () ->
                write("[ERROR] " + msg)
            );
        }

        public static CompletableFuture<Void> logError(String scope, Throwable error) {
            return enqueue(LogLevel.ERROR.getValue(), () ->
                write("[ERROR] " + scope + ": " + getThrowableMsg(error))
            );
        }

        public static CompletableFuture<Void> logError(String scope, String msg, Throwable error) {
            return enqueue(LogLevel.ERROR.getValue(), () ->
                write("[ERROR] " + scope + ": '" + msg + "' - " + getThrowableMsg(error))
            );
        }

        public static CompletableFuture<Void> logJson(String scope, JsonObject json) {
            return enqueue(LogLevel.ALL.getValue(), () ->{
                Gson gson = new GsonBuilder().setPrettyPrinting().create();
                write("**" + scope + "**\n" + gson.toJson(json));
            });
        }

        public static CompletableFuture<Void> logMsg(String msg) {
            return enqueue(LogLevel.ALL.getValue(), () -> {
                write(msg);
            });
        }

        /**
         * Enqueues a log action with priority checking and timeout handling.
         * The returned future completes when the line is written, times out,
         * or fails.
         */
        private static CompletableFuture<Void> enqueue(int priority, Runnable action) {
            if (priority > logLevel) {
                return CompletableFuture.completedFuture(null);
            }

            CompletableFuture<Void> future = logExecutor.execute(action);

            return future
                .orTimeout(LOG_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .whenComplete((v, ex) -> {
                    if(ex != null){
                        if (ex instanceof TimeoutException) {
                            System.err.println("[LOG TIMEOUT] Write hung after " + LOG_TIMEOUT_MS + "ms");
                        } else {
                            System.err.println("[LOG ERROR] " + ex.toString());
                        }
                    }
                });
        }

        private static void write(String text) {
            try {
                Files.writeString(
                    logFile.toPath(),
                    TimeHelpers.formatTime(System.currentTimeMillis()) + " " + text + "\n",
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
                );
            } catch (Exception e) {
                System.err.println("[LOG WRITE FAILED] " + e.getMessage());
            }
        }
    }

    public static String getThrowableMsg(Throwable throwable){
        if(throwable != null){
            return throwable.getMessage() != null ? throwable.getMessage() : throwable.getClass().getSimpleName();
        }else{
            return "unknown";
        }
    }
}
