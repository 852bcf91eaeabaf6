package com.plugbox.api.security;

import java.lang.annotation.*;

/**
 * 标记插件 API 方法所需的权限类别
 * <p>
 * 方法的第一个参数即为受控资源（文件路径、URL、模型 ID），其余类别只看是否授予。
 * </p>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RequiresPermission {

    PermissionCategory value();
}
