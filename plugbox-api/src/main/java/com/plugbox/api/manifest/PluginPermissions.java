package com.plugbox.api.manifest;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 对应 plugin.yml 的 permissions 节点
 * <p>
 * 所有子节点缺省即为拒绝：数组默认为空，布尔默认为 false，不存在继承关系。
 * 对象不可变，可直接作为冻结快照的来源。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class PluginPermissions {

    @Builder.Default
    Filesystem filesystem = Filesystem.NONE;
    @Builder.Default
    Network network = Network.NONE;
    @Builder.Default
    Agents agents = Agents.NONE;
    @Builder.Default
    Models models = Models.NONE;
    @Builder.Default
    Memory memory = Memory.NONE;
    @Builder.Default
    Ui ui = Ui.NONE;

    public static PluginPermissions none() {
        return PluginPermissions.builder().build();
    }

    // ==================== 嵌套类 ====================

    /**
     * 文件权限，路径为相对插件目录的 glob
     */
    public record Filesystem(List<String> read, List<String> write) {
        public static final Filesystem NONE = new Filesystem(List.of(), List.of());

        public Filesystem {
            read = read == null ? List.of() : List.copyOf(read);
            write = write == null ? List.of() : List.copyOf(write);
        }
    }

    /**
     * 网络权限，domains 支持精确匹配与后缀匹配
     */
    public record Network(List<String> domains, boolean external) {
        public static final Network NONE = new Network(List.of(), false);

        public Network {
            domains = domains == null ? List.of() : List.copyOf(domains);
        }
    }

    public record Agents(boolean create, boolean execute, boolean manage) {
        public static final Agents NONE = new Agents(false, false, false);
    }

    /**
     * 模型权限，access 中的 "*" 表示全部模型
     */
    public record Models(List<String> access, boolean execute) {
        public static final Models NONE = new Models(List.of(), false);

        public Models {
            access = access == null ? List.of() : List.copyOf(access);
        }
    }

    public record Memory(boolean read, boolean write) {
        public static final Memory NONE = new Memory(false, false);
    }

    public record Ui(boolean panels, boolean menus, boolean commands, boolean notifications) {
        public static final Ui NONE = new Ui(false, false, false, false);
    }
}
