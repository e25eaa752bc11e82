package com.minizeries.module;

import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 表函数注册表
 *
 * 按名称（不区分大小写）注册表函数模块，查询执行器通过它解析 FROM 子句中的函数名。
 *
 * @author Mini-Zeries
 */
@Slf4j
public class ModuleRegistry {

    private final Map<String, SeriesModule> modules = new ConcurrentHashMap<>();

    /**
     * 创建已注册 generate_zeries 的注册表
     */
    public static ModuleRegistry withDefaults() {
        ModuleRegistry registry = new ModuleRegistry();
        registry.register(new SeriesModule());
        return registry;
    }

    public void register(SeriesModule module) {
        register(module.getName(), module);
    }

    /**
     * 以指定名称注册模块
     *
     * @throws IllegalArgumentException 名称已被注册
     */
    public void register(String name, SeriesModule module) {
        String key = name.toLowerCase(Locale.ROOT);
        if (modules.putIfAbsent(key, module) != null) {
            throw new IllegalArgumentException("Module already registered: " + name);
        }
        log.info("Registered table function: {}", name);
    }

    /**
     * 查找模块
     *
     * @return 模块，未注册时返回 null
     */
    public SeriesModule find(String name) {
        return modules.get(name.toLowerCase(Locale.ROOT));
    }
}
