package com.gatehouse.api.error;

import java.util.List;
import java.util.Set;

/**
 * One entry of an error response's {@code detail} array.
 *
 * <pre>
 * {"detail": [{"type": "not_found", "msg": "resource not found", "input": "…", "loc": ["ResourceService", "get"], "ctx": null}]}
 * </pre>
 *
 * @param type error category
 * @param msg client-facing message
 * @param input the offending input, if any
 * @param loc where the error was raised; defaults to {@code [class, method]} of the caller
 * @param ctx extra context, such as validation failures
 */
public record ApiError(ErrorType type, String msg, Object input, List<String> loc, Object ctx) {

    private static final StackWalker WALKER = StackWalker.getInstance();
    private static final Set<String> FACTORY_CLASSES = Set.of(ApiError.class.getName(), ApiException.class.getName());

    public ApiError {
        if (loc == null) {
            loc = callSite();
        }
    }

    public static ApiError of(ErrorType type, String msg) {
        return new ApiError(type, msg, null, null, null);
    }

    public static ApiError of(ErrorType type, String msg, Object input) {
        return new ApiError(type, msg, input, null, null);
    }

    public static ApiError of(ErrorType type, String msg, Object input, Object ctx) {
        return new ApiError(type, msg, input, null, ctx);
    }

    public ApiError withInput(Object newInput) {
        return new ApiError(type, msg, newInput, loc, ctx);
    }

    // First frame outside the error factories.
    private static List<String> callSite() {
        return WALKER.walk(frames -> frames
                .filter(frame -> !FACTORY_CLASSES.contains(frame.getClassName()))
                .findFirst()
                .map(frame -> List.of(simpleName(frame.getClassName()), frame.getMethodName()))
                .orElse(List.of()));
    }

    private static String simpleName(String className) {
        return className.substring(className.lastIndexOf('.') + 1);
    }
}
