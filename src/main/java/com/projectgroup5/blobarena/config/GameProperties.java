package com.projectgroup5.blobarena.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 游戏配置（application.yml 中 game.* 前缀）
 * 启动时调用 {@link #validate()}，非法配置直接让服务器启动失败
 */
@ConfigurationProperties(prefix = "game")
public class GameProperties {

    private World world = new World();
    private Player player = new Player();
    private Food food = new Food();
    private Skills skills = new Skills();
    private Server server = new Server();
    private Network network = new Network();
    private Survival survival = new Survival();

    /**
     * 检查几何和数值配置，不合法时抛出 IllegalStateException
     */
    public void validate() {
        require(world.width > 0 && world.height > 0, "game.world width/height must be positive");
        require(world.padding >= 0, "game.world.padding must be >= 0");
        require(player.baseRadius > 0, "game.player.base-radius must be positive");
        require(player.maxRadius >= player.baseRadius, "game.player.max-radius must be >= base-radius");
        require(player.growthFactor >= 0 && player.growthExponent > 0, "game.player growth parameters are invalid");
        require(player.baseSpeed > 0 && player.minSpeed >= 0, "game.player speed parameters are invalid");
        require(player.eatRatio >= 1.0, "game.player.eat-ratio must be >= 1.0");
        require(player.spawnAttempts > 0, "game.player.spawn-attempts must be positive");
        require(player.nameMinLength > 0 && player.nameMaxLength >= player.nameMinLength,
                "game.player name length limits are invalid");
        require(food.radius > 0, "game.food.radius must be positive");
        require(food.minCount >= 0 && food.maxCount >= food.minCount, "game.food min/max count are invalid");
        require(food.spawnRate >= 0, "game.food.spawn-rate must be >= 0");
        skills.push.validate("push");
        skills.pull.validate("pull");
        require(server.tickRate > 0, "game.server.tick-rate must be positive");
        require(server.maxPlayers > 0, "game.server.max-players must be positive");
        require(network.port >= 0 && network.port <= 65535, "game.network.port is out of range");
        require(network.maxMessageSize > 0, "game.network.max-message-size must be positive");
        require(network.outboundQueueSize > 0, "game.network.outbound-queue-size must be positive");
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    public World getWorld() { return world; }
    public void setWorld(World world) { this.world = world; }

    public Player getPlayer() { return player; }
    public void setPlayer(Player player) { this.player = player; }

    public Food getFood() { return food; }
    public void setFood(Food food) { this.food = food; }

    public Skills getSkills() { return skills; }
    public void setSkills(Skills skills) { this.skills = skills; }

    public Server getServer() { return server; }
    public void setServer(Server server) { this.server = server; }

    public Network getNetwork() { return network; }
    public void setNetwork(Network network) { this.network = network; }

    public Survival getSurvival() { return survival; }
    public void setSurvival(Survival survival) { this.survival = survival; }

    public static class World {
        private double width = 3000;
        private double height = 3000;
        // 出生点距离边界的留白
        private double padding = 20;

        public double getWidth() { return width; }
        public void setWidth(double width) { this.width = width; }

        public double getHeight() { return height; }
        public void setHeight(double height) { this.height = height; }

        public double getPadding() { return padding; }
        public void setPadding(double padding) { this.padding = padding; }
    }

    public static class Player {
        private double baseRadius = 20;
        private double maxRadius = 300;
        private double growthFactor = 1.0;
        private double growthExponent = 0.75;
        // 像素/秒
        private double baseSpeed = 240;
        private double minSpeed = 60;
        // 0 表示速度不随体积变化
        private double speedDecay = 0.5;
        private double eatRatio = 1.2;
        private double eatScoreFactor = 1.0;
        private int eatBonus = 10;
        private Duration respawnCooldown = Duration.ofSeconds(3);
        private double minSpawnDistance = 150;
        private int spawnAttempts = 50;
        private int nameMinLength = 3;
        private int nameMaxLength = 20;
        private List<List<Integer>> colors = new ArrayList<>(List.of(
                List.of(255, 99, 71), List.of(65, 105, 225), List.of(60, 179, 113), List.of(238, 130, 238)));

        public double getBaseRadius() { return baseRadius; }
        public void setBaseRadius(double baseRadius) { this.baseRadius = baseRadius; }

        public double getMaxRadius() { return maxRadius; }
        public void setMaxRadius(double maxRadius) { this.maxRadius = maxRadius; }

        public double getGrowthFactor() { return growthFactor; }
        public void setGrowthFactor(double growthFactor) { this.growthFactor = growthFactor; }

        public double getGrowthExponent() { return growthExponent; }
        public void setGrowthExponent(double growthExponent) { this.growthExponent = growthExponent; }

        public double getBaseSpeed() { return baseSpeed; }
        public void setBaseSpeed(double baseSpeed) { this.baseSpeed = baseSpeed; }

        public double getMinSpeed() { return minSpeed; }
        public void setMinSpeed(double minSpeed) { this.minSpeed = minSpeed; }

        public double getSpeedDecay() { return speedDecay; }
        public void setSpeedDecay(double speedDecay) { this.speedDecay = speedDecay; }

        public double getEatRatio() { return eatRatio; }
        public void setEatRatio(double eatRatio) { this.eatRatio = eatRatio; }

        public double getEatScoreFactor() { return eatScoreFactor; }
        public void setEatScoreFactor(double eatScoreFactor) { this.eatScoreFactor = eatScoreFactor; }

        public int getEatBonus() { return eatBonus; }
        public void setEatBonus(int eatBonus) { this.eatBonus = eatBonus; }

        public Duration getRespawnCooldown() { return respawnCooldown; }
        public void setRespawnCooldown(Duration respawnCooldown) { this.respawnCooldown = respawnCooldown; }

        public double getMinSpawnDistance() { return minSpawnDistance; }
        public void setMinSpawnDistance(double minSpawnDistance) { this.minSpawnDistance = minSpawnDistance; }

        public int getSpawnAttempts() { return spawnAttempts; }
        public void setSpawnAttempts(int spawnAttempts) { this.spawnAttempts = spawnAttempts; }

        public int getNameMinLength() { return nameMinLength; }
        public void setNameMinLength(int nameMinLength) { this.nameMinLength = nameMinLength; }

        public int getNameMaxLength() { return nameMaxLength; }
        public void setNameMaxLength(int nameMaxLength) { this.nameMaxLength = nameMaxLength; }

        public List<List<Integer>> getColors() { return colors; }
        public void setColors(List<List<Integer>> colors) { this.colors = colors; }
    }

    public static class Food {
        private double radius = 6;
        private int value = 1;
        private int minCount = 150;
        private int maxCount = 300;
        // 每秒最多补充的食物数量（超过 minCount 之后）
        private double spawnRate = 10;
        private double minPlayerDistance = 30;
        private List<List<Integer>> colors = new ArrayList<>(List.of(
                List.of(255, 215, 0), List.of(0, 206, 209), List.of(255, 105, 180)));

        public double getRadius() { return radius; }
        public void setRadius(double radius) { this.radius = radius; }

        public int getValue() { return value; }
        public void setValue(int value) { this.value = value; }

        public int getMinCount() { return minCount; }
        public void setMinCount(int minCount) { this.minCount = minCount; }

        public int getMaxCount() { return maxCount; }
        public void setMaxCount(int maxCount) { this.maxCount = maxCount; }

        public double getSpawnRate() { return spawnRate; }
        public void setSpawnRate(double spawnRate) { this.spawnRate = spawnRate; }

        public double getMinPlayerDistance() { return minPlayerDistance; }
        public void setMinPlayerDistance(double minPlayerDistance) { this.minPlayerDistance = minPlayerDistance; }

        public List<List<Integer>> getColors() { return colors; }
        public void setColors(List<List<Integer>> colors) { this.colors = colors; }
    }

    public static class Skills {
        private SkillSettings push = new SkillSettings(100, 20, 12, Duration.ofSeconds(1), Duration.ofSeconds(5), 1.5);
        private SkillSettings pull = new SkillSettings(120, 20, 8, Duration.ofSeconds(1), Duration.ofSeconds(5), 1.0);

        public SkillSettings getPush() { return push; }
        public void setPush(SkillSettings push) { this.push = push; }

        public SkillSettings getPull() { return pull; }
        public void setPull(SkillSettings pull) { this.pull = pull; }
    }

    /**
     * 单个技能的参数，push / pull 共用
     */
    public static class SkillSettings {
        private double baseRadius;
        private double radiusPerLevel;
        private double force;
        private Duration duration;
        private Duration cooldown;
        private double sizeThresholdMultiplier;

        public SkillSettings() {
            this(100, 20, 10, Duration.ofSeconds(1), Duration.ofSeconds(5), 1.0);
        }

        public SkillSettings(double baseRadius, double radiusPerLevel, double force,
                             Duration duration, Duration cooldown, double sizeThresholdMultiplier) {
            this.baseRadius = baseRadius;
            this.radiusPerLevel = radiusPerLevel;
            this.force = force;
            this.duration = duration;
            this.cooldown = cooldown;
            this.sizeThresholdMultiplier = sizeThresholdMultiplier;
        }

        void validate(String name) {
            require(baseRadius >= 0 && radiusPerLevel >= 0, "game.skills." + name + " radius is invalid");
            require(force >= 0, "game.skills." + name + ".force must be >= 0");
            require(duration != null && !duration.isNegative(), "game.skills." + name + ".duration is invalid");
            require(cooldown != null && !cooldown.isNegative(), "game.skills." + name + ".cooldown is invalid");
            require(sizeThresholdMultiplier > 0, "game.skills." + name + ".size-threshold-multiplier must be positive");
        }

        public double getBaseRadius() { return baseRadius; }
        public void setBaseRadius(double baseRadius) { this.baseRadius = baseRadius; }

        public double getRadiusPerLevel() { return radiusPerLevel; }
        public void setRadiusPerLevel(double radiusPerLevel) { this.radiusPerLevel = radiusPerLevel; }

        public double getForce() { return force; }
        public void setForce(double force) { this.force = force; }

        public Duration getDuration() { return duration; }
        public void setDuration(Duration duration) { this.duration = duration; }

        public Duration getCooldown() { return cooldown; }
        public void setCooldown(Duration cooldown) { this.cooldown = cooldown; }

        public double getSizeThresholdMultiplier() { return sizeThresholdMultiplier; }
        public void setSizeThresholdMultiplier(double sizeThresholdMultiplier) { this.sizeThresholdMultiplier = sizeThresholdMultiplier; }
    }

    public static class Server {
        private int tickRate = 30;
        private int maxPlayers = 20;

        public int getTickRate() { return tickRate; }
        public void setTickRate(int tickRate) { this.tickRate = tickRate; }

        public int getMaxPlayers() { return maxPlayers; }
        public void setMaxPlayers(int maxPlayers) { this.maxPlayers = maxPlayers; }
    }

    public static class Network {
        private String host = "0.0.0.0";
        private int port = 5555;
        private Duration keepaliveTimeout = Duration.ofSeconds(30);
        private int maxMessageSize = 64 * 1024;
        private int outboundQueueSize = 256;
        private ConnectRate connectRate = new ConnectRate();
        private String serverFullMessage = "Server is full, please try again later";
        private String usernameTakenMessage = "Username is already taken";

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public Duration getKeepaliveTimeout() { return keepaliveTimeout; }
        public void setKeepaliveTimeout(Duration keepaliveTimeout) { this.keepaliveTimeout = keepaliveTimeout; }

        public int getMaxMessageSize() { return maxMessageSize; }
        public void setMaxMessageSize(int maxMessageSize) { this.maxMessageSize = maxMessageSize; }

        public int getOutboundQueueSize() { return outboundQueueSize; }
        public void setOutboundQueueSize(int outboundQueueSize) { this.outboundQueueSize = outboundQueueSize; }

        public ConnectRate getConnectRate() { return connectRate; }
        public void setConnectRate(ConnectRate connectRate) { this.connectRate = connectRate; }

        public String getServerFullMessage() { return serverFullMessage; }
        public void setServerFullMessage(String serverFullMessage) { this.serverFullMessage = serverFullMessage; }

        public String getUsernameTakenMessage() { return usernameTakenMessage; }
        public void setUsernameTakenMessage(String usernameTakenMessage) { this.usernameTakenMessage = usernameTakenMessage; }
    }

    public static class ConnectRate {
        private int maxAttempts = 5;
        private Duration window = Duration.ofMinutes(1);

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
    }

    /**
     * 生存系统参数（可选模块，默认关闭）
     */
    public static class Survival {
        private boolean enabled = false;
        private double maxHealth = 100;
        private double maxCalories = 3000;
        private double maxHydration = 5000;
        private double maxBlood = 5000;
        private double caloriesDrainIdle = 1.0;
        private double hydrationDrainIdle = 1.5;
        private double moveMult = 1.5;
        private double sprintMult = 2.0;
        private double craftingMult = 1.2;
        private double starveHpLoss = 0.5;
        private double dehydrateHpLoss = 1.0;
        private double bleedLossPerSec = 10;
        private double lowBloodThreshold = 3000;
        private double lowBloodHpLoss = 0.5;
        private double infectionHpLoss = 0.2;
        private double hypothermiaThreshold = 35.0;
        private double hypothermiaHpLoss = 0.5;
        private double heatstrokeThreshold = 40.0;
        private double heatstrokeHydrationDrain = 2.0;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public double getMaxHealth() { return maxHealth; }
        public void setMaxHealth(double maxHealth) { this.maxHealth = maxHealth; }

        public double getMaxCalories() { return maxCalories; }
        public void setMaxCalories(double maxCalories) { this.maxCalories = maxCalories; }

        public double getMaxHydration() { return maxHydration; }
        public void setMaxHydration(double maxHydration) { this.maxHydration = maxHydration; }

        public double getMaxBlood() { return maxBlood; }
        public void setMaxBlood(double maxBlood) { this.maxBlood = maxBlood; }

        public double getCaloriesDrainIdle() { return caloriesDrainIdle; }
        public void setCaloriesDrainIdle(double caloriesDrainIdle) { this.caloriesDrainIdle = caloriesDrainIdle; }

        public double getHydrationDrainIdle() { return hydrationDrainIdle; }
        public void setHydrationDrainIdle(double hydrationDrainIdle) { this.hydrationDrainIdle = hydrationDrainIdle; }

        public double getMoveMult() { return moveMult; }
        public void setMoveMult(double moveMult) { this.moveMult = moveMult; }

        public double getSprintMult() { return sprintMult; }
        public void setSprintMult(double sprintMult) { this.sprintMult = sprintMult; }

        public double getCraftingMult() { return craftingMult; }
        public void setCraftingMult(double craftingMult) { this.craftingMult = craftingMult; }

        public double getStarveHpLoss() { return starveHpLoss; }
        public void setStarveHpLoss(double starveHpLoss) { this.starveHpLoss = starveHpLoss; }

        public double getDehydrateHpLoss() { return dehydrateHpLoss; }
        public void setDehydrateHpLoss(double dehydrateHpLoss) { this.dehydrateHpLoss = dehydrateHpLoss; }

        public double getBleedLossPerSec() { return bleedLossPerSec; }
        public void setBleedLossPerSec(double bleedLossPerSec) { this.bleedLossPerSec = bleedLossPerSec; }

        public double getLowBloodThreshold() { return lowBloodThreshold; }
        public void setLowBloodThreshold(double lowBloodThreshold) { this.lowBloodThreshold = lowBloodThreshold; }

        public double getLowBloodHpLoss() { return lowBloodHpLoss; }
        public void setLowBloodHpLoss(double lowBloodHpLoss) { this.lowBloodHpLoss = lowBloodHpLoss; }

        public double getInfectionHpLoss() { return infectionHpLoss; }
        public void setInfectionHpLoss(double infectionHpLoss) { this.infectionHpLoss = infectionHpLoss; }

        public double getHypothermiaThreshold() { return hypothermiaThreshold; }
        public void setHypothermiaThreshold(double hypothermiaThreshold) { this.hypothermiaThreshold = hypothermiaThreshold; }

        public double getHypothermiaHpLoss() { return hypothermiaHpLoss; }
        public void setHypothermiaHpLoss(double hypothermiaHpLoss) { this.hypothermiaHpLoss = hypothermiaHpLoss; }

        public double getHeatstrokeThreshold() { return heatstrokeThreshold; }
        public void setHeatstrokeThreshold(double heatstrokeThreshold) { this.heatstrokeThreshold = heatstrokeThreshold; }

        public double getHeatstrokeHydrationDrain() { return heatstrokeHydrationDrain; }
        public void setHeatstrokeHydrationDrain(double heatstrokeHydrationDrain) { this.heatstrokeHydrationDrain = heatstrokeHydrationDrain; }
    }
}
