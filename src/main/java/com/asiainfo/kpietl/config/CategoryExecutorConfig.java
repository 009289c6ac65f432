package com.asiainfo.kpietl.config;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * KPI 计算线程池配置
 * 按需创建线程、空闲回收，同时提交的分类全部并行；应用内共享一个实例
 */
@ApplicationScoped
public class CategoryExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(CategoryExecutorConfig.class);

    private ExecutorService categoryExecutor;

    void onStart(@Observes StartupEvent event) {
        this.categoryExecutor = Executors.newCachedThreadPool(new CategoryThreadFactory());
        log.info("分类计算线程池初始化完成");
    }

    void onStop(@Observes ShutdownEvent event) {
        if (categoryExecutor != null) {
            categoryExecutor.shutdown();
            log.info("分类计算线程池已关闭");
        }
    }

    /**
     * 获取分类计算执行器
     * 每个分类一个任务，任务内部自行管理数据库连接
     */
    public ExecutorService getCategoryExecutor() {
        return categoryExecutor;
    }

    /**
     * 线程名带序号，便于日志排查
     */
    static final class CategoryThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "kpi-category-" + counter.incrementAndGet());
            t.setDaemon(false);
            return t;
        }
    }
}
