package dev.lzrvc.errortracker;

/**
 * Hook called for every breadcrumb before it is recorded. Returning {@code null} or
 * {@link HookResult#drop()} discards the breadcrumb.
 */
@FunctionalInterface
public interface BeforeBreadcrumbHook {

    HookResult<Breadcrumb> beforeBreadcrumb(Breadcrumb breadcrumb);
}
